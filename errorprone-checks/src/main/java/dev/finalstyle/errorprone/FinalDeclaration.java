package dev.finalstyle.errorprone;

import com.google.errorprone.VisitorState;
import com.google.errorprone.util.ASTHelpers;
import com.google.errorprone.util.ErrorProneToken;
import com.sun.source.tree.BindingPatternTree;
import com.sun.source.tree.ModifiersTree;
import com.sun.source.tree.Tree;
import com.sun.source.tree.VariableTree;
import com.sun.tools.javac.parser.Tokens.TokenKind;
import com.sun.tools.javac.util.Position;
import javax.lang.model.element.Modifier;
import org.jetbrains.annotations.Nullable;

/**
 * What a single declaration says about its {@code final} modifier: whether the modifier is set, the {@code final}
 * keyword token to anchor a diagnostic on, and whether the declared type is written out in source.
 *
 * <p>The token can be {@code null} while {@code hasFinal} is true. javac marks some declarations final without a
 * keyword, try-with-resources variables among them; those have nothing to point at.
 */
record FinalDeclaration(boolean hasFinal, @Nullable ErrorProneToken finalToken, boolean hasExplicitType) {

    static final FinalDeclaration NONE = new FinalDeclaration(false, null, false);

    /**
     * The variable declared by a parameter, loop variable, local variable or binding pattern. Binding patterns wrap
     * their variable one level deep and are unwrapped once; every other node kind declares nothing.
     */
    static @Nullable VariableTree declaredVariable(@Nullable Tree node) {
        if (node == null) {
            return null;
        }
        return switch (node.getKind()) {
            case VARIABLE -> (VariableTree) node;
            case BINDING_PATTERN -> ((BindingPatternTree) node).getVariable();
            default -> null;
        };
    }

    /** Inspects the variable {@link #declaredVariable} finds in {@code node}, or yields {@link #NONE}. */
    static FinalDeclaration of(@Nullable Tree node, VisitorState state) {
        var variable = declaredVariable(node);
        return variable == null ? NONE : ofVariable(variable, state);
    }

    /** Only declarations with a {@code final} keyword in source get a diagnostic. */
    boolean reportable() {
        return hasFinal && finalToken != null;
    }

    private static FinalDeclaration ofVariable(VariableTree variable, VisitorState state) {
        var modifiers = variable.getModifiers();
        if (!modifiers.getFlags().contains(Modifier.FINAL)) {
            return NONE;
        }
        return new FinalDeclaration(
                true, findFinalToken(modifiers, state), !ASTHelpers.hasImplicitType(variable, state));
    }

    private static @Nullable ErrorProneToken findFinalToken(ModifiersTree modifiers, VisitorState state) {
        int start = ASTHelpers.getStartPosition(modifiers);
        int end = state.getEndPosition(modifiers);
        if (start == Position.NOPOS || end == Position.NOPOS || end <= start) {
            return null;
        }
        for (var token : state.getOffsetTokensForNode(modifiers)) {
            if (token.kind() == TokenKind.FINAL) {
                return token;
            }
        }
        return null;
    }
}
