package co.fanki.complexity.analysis.domain;

import co.fanki.complexity.shared.Preconditions;

import java.util.List;

/**
 * Selects the function-like members of a syntax tree.
 *
 * <p>A member is any immediate child of a class-like declaration
 * (interfaces excluded) that contains at least one statement other than
 * a block somewhere below it. Methods, constructors, initializers and
 * nested types with code all qualify; fields without executable
 * initializers, abstract methods and empty bodies do not.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class FunctionExtractor {

    private FunctionExtractor() {
    }

    /**
     * Extracts the member candidates of a parsed file.
     *
     * @param tree the syntax tree, not null
     * @return the candidates, in no particular order
     */
    public static List<MemberCandidate> extract(final SyntaxTree tree) {
        Preconditions.requireNonNull(tree, "Syntax tree is required");

        return tree.root().descendants()
                .filter(node -> node.kind().declaresMembers())
                .flatMap(type -> type.children().stream())
                .filter(FunctionExtractor::hasExecutableCode)
                .map(MemberCandidate::new)
                .toList();
    }

    /**
     * Checks whether a node contains a statement that is not a block.
     *
     * @param member the member node
     * @return true if it has executable code
     */
    static boolean hasExecutableCode(final SyntaxNode member) {
        return member.descendants()
                .anyMatch(node -> node.kind().isStatement()
                        && !node.kind().isBlock());
    }

}
