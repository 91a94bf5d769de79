package dev.finalstyle.errorprone;

import com.google.auto.service.AutoService;
import com.google.errorprone.BugPattern;
import com.google.errorprone.VisitorState;
import com.google.errorprone.bugpatterns.BugChecker;
import com.google.errorprone.matchers.Description;
import com.sun.source.tree.BlockTree;
import com.sun.source.tree.CaseTree;
import com.sun.source.tree.CatchTree;
import com.sun.source.tree.EnhancedForLoopTree;
import com.sun.source.tree.InstanceOfTree;
import com.sun.source.tree.LambdaExpressionTree;
import com.sun.source.tree.MethodTree;
import com.sun.source.tree.StatementTree;
import com.sun.source.tree.Tree;
import com.sun.tools.javac.util.JCDiagnostic.SimpleDiagnosticPosition;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Flags {@code final} on local variables and parameters for code bases that prefer the {@code var}/mutable style.
 *
 * <p>Inspected declarations:
 * - method, constructor, lambda and catch parameters
 * - the variable of an enhanced for loop (counted {@code for} loops are ignored)
 * - local variable declaration statements, once per statement however many variables it declares
 * - {@code instanceof} binding patterns
 *
 * Fields are never inspected.
 */
@AutoService(BugChecker.class)
@BugPattern(
        name = "UnnecessaryFinal",
        summary = "Don't use 'final' for local variables.",
        explanation =
                "Use 'var' or a plain type, not 'final', when declaring local variables and parameters. "
                        + "Of the two styles in wide use this check enforces the mutable one; "
                        + "the FinalLocals and FinalParameters checks enforce the other.",
        severity = BugPattern.SeverityLevel.WARNING,
        tags = BugPattern.StandardTags.STYLE,
        documentSuppression = true)
@IncompatibleWith({"FinalLocals", "FinalParameters"})
public final class UnnecessaryFinalChecker extends BugChecker
        implements BugChecker.MethodTreeMatcher,
                BugChecker.LambdaExpressionTreeMatcher,
                BugChecker.CatchTreeMatcher,
                BugChecker.EnhancedForLoopTreeMatcher,
                BugChecker.BlockTreeMatcher,
                BugChecker.CaseTreeMatcher,
                BugChecker.InstanceOfTreeMatcher {

    @Override
    public Description matchMethod(MethodTree tree, VisitorState state) {
        checkParameters(tree.getParameters(), state);
        return Description.NO_MATCH;
    }

    @Override
    public Description matchLambdaExpression(LambdaExpressionTree tree, VisitorState state) {
        checkParameters(tree.getParameters(), state);
        return Description.NO_MATCH;
    }

    @Override
    public Description matchCatch(CatchTree tree, VisitorState state) {
        checkParameters(List.of(tree.getParameter()), state);
        return Description.NO_MATCH;
    }

    @Override
    public Description matchEnhancedForLoop(EnhancedForLoopTree tree, VisitorState state) {
        check(tree.getVariable(), state);
        return Description.NO_MATCH;
    }

    @Override
    public Description matchBlock(BlockTree tree, VisitorState state) {
        checkStatements(tree.getStatements(), state);
        return Description.NO_MATCH;
    }

    @Override
    public Description matchCase(CaseTree tree, VisitorState state) {
        // null for `case X ->` rules; a rule's block body is matched by matchBlock
        var statements = tree.getStatements();
        if (statements != null) {
            checkStatements(statements, state);
        }
        return Description.NO_MATCH;
    }

    @Override
    public Description matchInstanceOf(InstanceOfTree tree, VisitorState state) {
        check(tree.getPattern(), state);
        return Description.NO_MATCH;
    }

    private void checkParameters(List<? extends Tree> parameters, VisitorState state) {
        for (var parameter : parameters) {
            check(parameter, state);
        }
    }

    private void checkStatements(List<? extends StatementTree> statements, VisitorState state) {
        // co-declared variables share their modifiers and type, so the first one speaks for the statement
        for (var statement : DeclarationStatements.group(statements)) {
            check(statement.get(0), state);
        }
    }

    private void check(@Nullable Tree node, VisitorState state) {
        // reports come from the enclosing method or block, so suppression on the declaration is checked here
        var variable = FinalDeclaration.declaredVariable(node);
        if (variable == null || isSuppressed(variable, state)) {
            return;
        }
        var declaration = FinalDeclaration.of(variable, state);
        var token = declaration.finalToken();
        if (!declaration.reportable() || token == null) {
            return;
        }
        var variant = FinalStyleVariant.classify(declaration.hasExplicitType());
        state.reportMatch(buildDescription(new SimpleDiagnosticPosition(token.pos()))
                .setMessage(variant.diagnosticText())
                .build());
    }
}
