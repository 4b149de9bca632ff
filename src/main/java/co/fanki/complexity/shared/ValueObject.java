package co.fanki.complexity.shared;

import java.io.Serializable;

/**
 * Marker interface for immutable value types compared by their
 * attributes, such as ranking results and source locations.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface ValueObject extends Serializable {

}
