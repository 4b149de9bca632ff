package co.fanki.complexity.analysis.domain.java;

import co.fanki.complexity.analysis.domain.SourceLocation;
import co.fanki.complexity.analysis.domain.SourceParseException;
import co.fanki.complexity.analysis.domain.SourceParser;
import co.fanki.complexity.analysis.domain.SyntaxKind;
import co.fanki.complexity.analysis.domain.SyntaxNode;
import co.fanki.complexity.analysis.domain.SyntaxTree;
import co.fanki.complexity.shared.Preconditions;
import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ParserConfiguration.LanguageLevel;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.AnnotationDeclaration;
import com.github.javaparser.ast.body.AnnotationMemberDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.CompactConstructorDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.EnumConstantDeclaration;
import com.github.javaparser.ast.body.EnumDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.InitializerDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.RecordDeclaration;
import com.github.javaparser.ast.comments.Comment;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.SwitchExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.AssertStmt;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.BreakStmt;
import com.github.javaparser.ast.stmt.CatchClause;
import com.github.javaparser.ast.stmt.ContinueStmt;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.EmptyStmt;
import com.github.javaparser.ast.stmt.ExplicitConstructorInvocationStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.LabeledStmt;
import com.github.javaparser.ast.stmt.LocalClassDeclarationStmt;
import com.github.javaparser.ast.stmt.LocalRecordDeclarationStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.github.javaparser.ast.stmt.SwitchStmt;
import com.github.javaparser.ast.stmt.SynchronizedStmt;
import com.github.javaparser.ast.stmt.ThrowStmt;
import com.github.javaparser.ast.stmt.TryStmt;
import com.github.javaparser.ast.stmt.WhileStmt;
import com.github.javaparser.ast.stmt.YieldStmt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Java implementation of {@link SourceParser} backed by JavaParser.
 *
 * <p>Parses each {@code .java} file into a JavaParser compilation unit and
 * translates it node by node into the {@link SyntaxKind} vocabulary:</p>
 * <ul>
 *   <li>{@code synchronized} blocks become lock statements</li>
 *   <li>anonymous class bodies become anonymous method expressions</li>
 *   <li>local variable declarations become local declaration
 *       statements, other expression statements stay expression
 *       statements</li>
 *   <li>the implicit statement around an expression-bodied lambda is
 *       an expression</li>
 *   <li>comments are dropped</li>
 *   <li>anything not listed maps to {@link SyntaxKind#OTHER} or, for
 *       expressions, {@link SyntaxKind#EXPRESSION}</li>
 * </ul>
 *
 * <p>A fresh JavaParser instance is created per file, so this class can
 * be shared between threads.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class JavaSourceParser extends SourceParser {

    private static final Logger LOG = LoggerFactory.getLogger(
            JavaSourceParser.class);

    private static final String EXTENSION = ".java";

    /** Node classes that translate to a single kind. */
    private static final Map<Class<? extends Node>, SyntaxKind> KINDS =
            Map.ofEntries(
                    Map.entry(CompilationUnit.class,
                            SyntaxKind.COMPILATION_UNIT),
                    Map.entry(EnumDeclaration.class,
                            SyntaxKind.ENUM_DECLARATION),
                    Map.entry(RecordDeclaration.class,
                            SyntaxKind.RECORD_DECLARATION),
                    Map.entry(AnnotationDeclaration.class,
                            SyntaxKind.ANNOTATION_DECLARATION),
                    Map.entry(MethodDeclaration.class,
                            SyntaxKind.METHOD_DECLARATION),
                    Map.entry(ConstructorDeclaration.class,
                            SyntaxKind.CONSTRUCTOR_DECLARATION),
                    Map.entry(CompactConstructorDeclaration.class,
                            SyntaxKind.CONSTRUCTOR_DECLARATION),
                    Map.entry(FieldDeclaration.class,
                            SyntaxKind.FIELD_DECLARATION),
                    Map.entry(InitializerDeclaration.class,
                            SyntaxKind.INITIALIZER_DECLARATION),
                    Map.entry(EnumConstantDeclaration.class,
                            SyntaxKind.ENUM_CONSTANT_DECLARATION),
                    Map.entry(AnnotationMemberDeclaration.class,
                            SyntaxKind.ANNOTATION_MEMBER_DECLARATION),
                    Map.entry(Parameter.class, SyntaxKind.PARAMETER),
                    Map.entry(BlockStmt.class, SyntaxKind.BLOCK),
                    Map.entry(ReturnStmt.class, SyntaxKind.RETURN_STATEMENT),
                    Map.entry(ThrowStmt.class, SyntaxKind.THROW_STATEMENT),
                    Map.entry(BreakStmt.class, SyntaxKind.BREAK_STATEMENT),
                    Map.entry(ContinueStmt.class,
                            SyntaxKind.CONTINUE_STATEMENT),
                    Map.entry(YieldStmt.class, SyntaxKind.YIELD_STATEMENT),
                    Map.entry(AssertStmt.class, SyntaxKind.ASSERT_STATEMENT),
                    Map.entry(EmptyStmt.class, SyntaxKind.EMPTY_STATEMENT),
                    Map.entry(ExplicitConstructorInvocationStmt.class,
                            SyntaxKind.CONSTRUCTOR_INVOCATION_STATEMENT),
                    Map.entry(IfStmt.class, SyntaxKind.IF_STATEMENT),
                    Map.entry(WhileStmt.class, SyntaxKind.WHILE_STATEMENT),
                    Map.entry(DoStmt.class, SyntaxKind.DO_STATEMENT),
                    Map.entry(ForStmt.class, SyntaxKind.FOR_STATEMENT),
                    Map.entry(ForEachStmt.class,
                            SyntaxKind.FOR_EACH_STATEMENT),
                    Map.entry(SwitchStmt.class, SyntaxKind.SWITCH_STATEMENT),
                    Map.entry(TryStmt.class, SyntaxKind.TRY_STATEMENT),
                    Map.entry(SynchronizedStmt.class,
                            SyntaxKind.LOCK_STATEMENT),
                    Map.entry(LabeledStmt.class,
                            SyntaxKind.LABELED_STATEMENT),
                    Map.entry(LocalClassDeclarationStmt.class,
                            SyntaxKind.LOCAL_TYPE_DECLARATION_STATEMENT),
                    Map.entry(LocalRecordDeclarationStmt.class,
                            SyntaxKind.LOCAL_TYPE_DECLARATION_STATEMENT),
                    Map.entry(SwitchEntry.class, SyntaxKind.SWITCH_SECTION),
                    Map.entry(CatchClause.class, SyntaxKind.CATCH_CLAUSE),
                    Map.entry(LambdaExpr.class,
                            SyntaxKind.LAMBDA_EXPRESSION),
                    Map.entry(SwitchExpr.class,
                            SyntaxKind.SWITCH_EXPRESSION)
            );

    /** {@inheritDoc} */
    @Override
    public String language() {
        return "java";
    }

    /**
     * Accepts files with the {@code .java} extension.
     *
     * @param file the candidate file
     * @return true for Java sources
     */
    @Override
    public boolean accepts(final Path file) {
        final Path name = file.getFileName();
        return name != null && name.toString().endsWith(EXTENSION);
    }

    /**
     * Parses a Java source file.
     *
     * <p>Files with syntax errors are rejected as a whole, even if
     * JavaParser could recover a partial tree.</p>
     *
     * @param file the .java file
     * @return the translated syntax tree
     * @throws IOException if the file cannot be read
     * @throws SourceParseException if the file has syntax errors
     */
    @Override
    public SyntaxTree parse(final Path file)
            throws IOException, SourceParseException {
        Preconditions.requireNonNull(file, "File is required");

        final ParseResult<CompilationUnit> result =
                newJavaParser().parse(file);

        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            final List<Problem> problems = result.getProblems();
            throw new SourceParseException(file, problems.isEmpty()
                    ? "no compilation unit produced"
                    : problems.get(0).getVerboseMessage());
        }

        final SyntaxNode root = translate(result.getResult().get(),
                file.toString(), 1);
        LOG.trace("Parsed {}", file);
        return new SyntaxTree(file, root);
    }

    private JavaParser newJavaParser() {
        return new JavaParser(new ParserConfiguration()
                .setLanguageLevel(LanguageLevel.JAVA_17)
                .setCharacterEncoding(StandardCharsets.UTF_8));
    }

    private SyntaxNode translate(final Node node, final String file,
            final int parentLine) {

        final int line = node.getBegin()
                .map(position -> position.line)
                .orElse(parentLine);

        final List<SyntaxNode> children = new ArrayList<>();
        for (final Node child : node.getChildNodes()) {
            if (child instanceof Comment) {
                continue;
            }
            children.add(translate(child, file, line));
        }

        return new SyntaxNode(kindOf(node), new SourceLocation(file, line),
                children);
    }

    /**
     * Maps a JavaParser node to its syntax kind.
     *
     * @param node the JavaParser node
     * @return the kind, never null
     */
    static SyntaxKind kindOf(final Node node) {
        final SyntaxKind direct = KINDS.get(node.getClass());
        if (direct != null) {
            return direct;
        }
        if (node instanceof ClassOrInterfaceDeclaration type) {
            return type.isInterface()
                    ? SyntaxKind.INTERFACE_DECLARATION
                    : SyntaxKind.CLASS_DECLARATION;
        }
        if (node instanceof ExpressionStmt statement) {
            if (isLambdaExpressionBody(statement)) {
                return SyntaxKind.EXPRESSION;
            }
            return statement.getExpression() instanceof VariableDeclarationExpr
                    ? SyntaxKind.LOCAL_DECLARATION_STATEMENT
                    : SyntaxKind.EXPRESSION_STATEMENT;
        }
        if (node instanceof ObjectCreationExpr creation
                && creation.getAnonymousClassBody().isPresent()) {
            return SyntaxKind.ANONYMOUS_METHOD_EXPRESSION;
        }
        if (node instanceof Expression) {
            return SyntaxKind.EXPRESSION;
        }
        return SyntaxKind.OTHER;
    }

    /**
     * JavaParser wraps the body of {@code x -> x + 1} in an
     * {@link ExpressionStmt} that has no counterpart in the source.
     */
    private static boolean isLambdaExpressionBody(
            final ExpressionStmt statement) {
        return statement.getParentNode()
                .filter(LambdaExpr.class::isInstance)
                .map(LambdaExpr.class::cast)
                .flatMap(LambdaExpr::getExpressionBody)
                .isPresent();
    }

}
