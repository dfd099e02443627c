package org.sjsu.botworker.service;

import org.sjsu.botworker.exception.BotCommandException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Arguments of a request bound to a command's parameter names, from positional {@code args}
 * first and then keyword {@code kwargs}.
 */
public final class CommandArguments {

    private final String command;
    private final Map<String, Object> values;

    private CommandArguments(String command, Map<String, Object> values) {
        this.command = command;
        this.values = Collections.unmodifiableMap(values);
    }

    /**
     * @param varArgs whether the command swallows arguments it does not declare
     */
    static CommandArguments bind(String command, List<String> parameters, boolean varArgs,
                                 List<Object> args, Map<String, Object> kwargs) {
        List<Object> positional = args == null ? List.of() : args;
        Map<String, Object> keywords = kwargs == null ? Map.of() : kwargs;
        Map<String, Object> bound = new LinkedHashMap<>();

        if (positional.size() > parameters.size() && !varArgs) {
            throw new BotCommandException(String.format("%s() takes %d positional argument(s) but %d were given",
                    command, parameters.size(), positional.size()));
        }
        for (int i = 0; i < Math.min(positional.size(), parameters.size()); i++) {
            bound.put(parameters.get(i), positional.get(i));
        }
        for (Map.Entry<String, Object> keyword : keywords.entrySet()) {
            String name = keyword.getKey();
            if (!parameters.contains(name)) {
                if (varArgs) {
                    continue;
                }
                throw new BotCommandException(String.format("%s() got an unexpected keyword argument '%s'", command, name));
            }
            if (bound.containsKey(name)) {
                throw new BotCommandException(String.format("%s() got multiple values for argument '%s'", command, name));
            }
            bound.put(name, keyword.getValue());
        }
        for (String parameter : parameters) {
            if (!bound.containsKey(parameter)) {
                throw new BotCommandException(String.format("%s() missing required argument: '%s'", command, parameter));
            }
        }
        return new CommandArguments(command, bound);
    }

    public String getString(String name) {
        Object value = values.get(name);
        if (value == null || value instanceof String) {
            return (String) value;
        }
        throw new BotCommandException(String.format("%s() argument '%s' must be a string, got %s",
                command, name, value.getClass().getSimpleName()));
    }
}
