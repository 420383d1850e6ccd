package org.regram.compiler.frontend.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered table of macro definitions. Insertion order is definition order and a definition's
 * {@link MacroDefinition#id()} equals its position. Only the {@link DefinitionParser} adds entries;
 * once parsing is over the table is read-only.
 */
public class MacroTable {

    private final List<MacroDefinition> definitions = new ArrayList<>();
    private final Map<String, MacroDefinition> byName = new HashMap<>();

    void add(MacroDefinition definition) {
        if (definition.id() != definitions.size()) {
            throw new IllegalArgumentException("Definition id " + definition.id() + " does not match position " + definitions.size());
        }
        definitions.add(definition);
        byName.put(definition.name(), definition);
    }

    /**
     * Looks up a macro by name.
     * @param name The macro name.
     * @return The definition, or empty if the name is not defined.
     */
    public Optional<MacroDefinition> get(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    /**
     * Checks whether a name is defined.
     * @param name The macro name.
     * @return {@code true} if a macro with this name exists.
     */
    public boolean contains(String name) {
        return byName.containsKey(name);
    }

    /**
     * Gets a macro by its definition ordinal.
     * @param id The macro id.
     * @return The definition.
     */
    public MacroDefinition byId(int id) {
        return definitions.get(id);
    }

    /**
     * Gets the number of macros.
     * @return The macro count.
     */
    public int size() {
        return definitions.size();
    }

    /**
     * Gets all definitions in definition order.
     * @return An unmodifiable view of the definitions.
     */
    public List<MacroDefinition> definitions() {
        return Collections.unmodifiableList(definitions);
    }
}
