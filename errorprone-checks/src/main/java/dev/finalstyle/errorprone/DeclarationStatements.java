package dev.finalstyle.errorprone;

import com.sun.source.tree.StatementTree;
import com.sun.source.tree.VariableTree;
import java.util.ArrayList;
import java.util.List;

/**
 * Regroups the local variable declarations of a statement list into the source statements they came from.
 *
 * <p>javac turns {@code final int a = 1, b = 2;} into two {@link VariableTree}s that share a single
 * {@link com.sun.source.tree.ModifiersTree} instance, so consecutive variables with the same modifiers object belong
 * to the same declaration statement.
 */
final class DeclarationStatements {

    private DeclarationStatements() {}

    static List<List<VariableTree>> group(List<? extends StatementTree> statements) {
        var groups = new ArrayList<List<VariableTree>>();
        List<VariableTree> current = null;
        for (var statement : statements) {
            if (!(statement instanceof VariableTree variable)) {
                current = null;
                continue;
            }
            if (current != null && current.get(0).getModifiers() == variable.getModifiers()) {
                current.add(variable);
            } else {
                current = new ArrayList<>();
                current.add(variable);
                groups.add(current);
            }
        }
        return groups;
    }
}
