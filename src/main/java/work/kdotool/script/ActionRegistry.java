package work.kdotool.script;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Fixed verb to fragment table shared by the parser (verb recognition) and the compiler.
 */
public final class ActionRegistry {
    private static final ActionRegistry STANDARD = new ActionRegistry(standardActions());

    private final Map<String, Action> actions;

    private ActionRegistry(Map<String, Action> actions) {
        this.actions = Collections.unmodifiableMap(new LinkedHashMap<>(actions));
    }

    public static ActionRegistry standard() {
        return STANDARD;
    }

    public Optional<Action> lookup(String verb) {
        return Optional.ofNullable(actions.get(verb));
    }

    public Set<String> verbs() {
        return actions.keySet();
    }

    public Collection<Action> actions() {
        return actions.values();
    }

    private static Map<String, Action> standardActions() {
        var table = new LinkedHashMap<String, Action>();
        query(table, "getwindowname", "output_result(w.caption);");
        query(table, "getwindowclassname", "output_result(w.resourceClass);");
        query(table, "getwindowgeometry",
            "output_result(`Window ${w.internalId}`); "
                + "output_result(`  Position: ${w.x},${w.y}`); "
                + "output_result(`  Geometry: ${w.width}x${w.height}`);");
        query(table, "getwindowpid", "output_result(w.pid);");
        mutation(table, "windowminimize", "w.minimized = true;");
        mutation(table, "windowraise", "workspace.raiseWindow(w);");
        mutation(table, "windowclose", "w.closeWindow();");
        mutation(table, "windowkill", "w.killWindow();");
        mutation(table, "windowactivate", "workspace.setActiveWindow(w);");
        return table;
    }

    private static void query(Map<String, Action> table, String verb, String fragment) {
        table.put(verb, new Action(verb, Action.Kind.QUERY, fragment));
    }

    private static void mutation(Map<String, Action> table, String verb, String fragment) {
        table.put(verb, new Action(verb, Action.Kind.MUTATION, fragment));
    }
}
