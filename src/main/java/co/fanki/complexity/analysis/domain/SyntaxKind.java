package co.fanki.complexity.analysis.domain;

/**
 * Closed vocabulary of syntax node kinds.
 *
 * <p>The vocabulary is shared by every {@link SourceParser} front end, so
 * it also names constructs that the Java front end never produces
 * (checked, unchecked, unsafe and fixed statements, structs). They take
 * part in the metrics exactly like the Java constructs do.</p>
 *
 * <p>Each kind belongs to one {@link Category}; the extractor and the
 * metrics only ever look at the category or at a fixed set of kinds.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum SyntaxKind {

    COMPILATION_UNIT(Category.OTHER),

    // Type declarations.
    CLASS_DECLARATION(Category.TYPE_DECLARATION),
    STRUCT_DECLARATION(Category.TYPE_DECLARATION),
    RECORD_DECLARATION(Category.TYPE_DECLARATION),
    ENUM_DECLARATION(Category.TYPE_DECLARATION),
    INTERFACE_DECLARATION(Category.TYPE_DECLARATION),
    ANNOTATION_DECLARATION(Category.MEMBER_DECLARATION),

    // Members.
    METHOD_DECLARATION(Category.MEMBER_DECLARATION),
    CONSTRUCTOR_DECLARATION(Category.MEMBER_DECLARATION),
    FIELD_DECLARATION(Category.MEMBER_DECLARATION),
    INITIALIZER_DECLARATION(Category.MEMBER_DECLARATION),
    ENUM_CONSTANT_DECLARATION(Category.MEMBER_DECLARATION),
    ANNOTATION_MEMBER_DECLARATION(Category.MEMBER_DECLARATION),
    PARAMETER(Category.OTHER),

    BLOCK(Category.BLOCK),

    // Simple statements: counted by the statement metric.
    EXPRESSION_STATEMENT(Category.SIMPLE_STATEMENT),
    LOCAL_DECLARATION_STATEMENT(Category.SIMPLE_STATEMENT),
    RETURN_STATEMENT(Category.SIMPLE_STATEMENT),
    THROW_STATEMENT(Category.SIMPLE_STATEMENT),
    BREAK_STATEMENT(Category.SIMPLE_STATEMENT),
    CONTINUE_STATEMENT(Category.SIMPLE_STATEMENT),
    YIELD_STATEMENT(Category.SIMPLE_STATEMENT),
    ASSERT_STATEMENT(Category.SIMPLE_STATEMENT),
    EMPTY_STATEMENT(Category.SIMPLE_STATEMENT),
    CONSTRUCTOR_INVOCATION_STATEMENT(Category.SIMPLE_STATEMENT),

    // Compound statements: own nested statements, not counted themselves.
    IF_STATEMENT(Category.COMPOUND_STATEMENT),
    WHILE_STATEMENT(Category.COMPOUND_STATEMENT),
    DO_STATEMENT(Category.COMPOUND_STATEMENT),
    FOR_STATEMENT(Category.COMPOUND_STATEMENT),
    FOR_EACH_STATEMENT(Category.COMPOUND_STATEMENT),
    SWITCH_STATEMENT(Category.COMPOUND_STATEMENT),
    TRY_STATEMENT(Category.COMPOUND_STATEMENT),
    LOCK_STATEMENT(Category.COMPOUND_STATEMENT),
    LABELED_STATEMENT(Category.COMPOUND_STATEMENT),
    LOCAL_TYPE_DECLARATION_STATEMENT(Category.COMPOUND_STATEMENT),
    CHECKED_STATEMENT(Category.COMPOUND_STATEMENT),
    UNCHECKED_STATEMENT(Category.COMPOUND_STATEMENT),
    UNSAFE_STATEMENT(Category.COMPOUND_STATEMENT),
    FIXED_STATEMENT(Category.COMPOUND_STATEMENT),

    // Statement parts.
    SWITCH_SECTION(Category.OTHER),
    CATCH_CLAUSE(Category.OTHER),

    // Expressions.
    LAMBDA_EXPRESSION(Category.EXPRESSION),
    ANONYMOUS_METHOD_EXPRESSION(Category.EXPRESSION),
    SWITCH_EXPRESSION(Category.EXPRESSION),
    EXPRESSION(Category.EXPRESSION),

    /** Names, types, modifiers, annotations and anything unclassified. */
    OTHER(Category.OTHER);

    /** Coarse grouping of kinds. */
    public enum Category {
        TYPE_DECLARATION,
        MEMBER_DECLARATION,
        BLOCK,
        SIMPLE_STATEMENT,
        COMPOUND_STATEMENT,
        EXPRESSION,
        OTHER
    }

    private final Category category;

    SyntaxKind(final Category theCategory) {
        this.category = theCategory;
    }

    /**
     * Returns the category of this kind.
     *
     * @return the category, never null
     */
    public Category category() {
        return category;
    }

    /**
     * Checks whether this kind is a statement of any form, blocks
     * included.
     *
     * @return true for blocks, simple and compound statements
     */
    public boolean isStatement() {
        return category == Category.BLOCK
                || category == Category.SIMPLE_STATEMENT
                || category == Category.COMPOUND_STATEMENT;
    }

    /**
     * Checks whether this kind is the block kind.
     *
     * @return true only for {@link #BLOCK}
     */
    public boolean isBlock() {
        return this == BLOCK;
    }

    /**
     * Checks whether this kind is counted by the statement metric.
     *
     * @return true for simple statements
     */
    public boolean isCountedStatement() {
        return category == Category.SIMPLE_STATEMENT;
    }

    /**
     * Checks whether nodes of this kind may declare extractable members.
     *
     * <p>Class-like and struct-like declarations qualify, interfaces do
     * not.</p>
     *
     * @return true for type declarations other than interfaces
     */
    public boolean declaresMembers() {
        return category == Category.TYPE_DECLARATION
                && this != INTERFACE_DECLARATION;
    }

}
