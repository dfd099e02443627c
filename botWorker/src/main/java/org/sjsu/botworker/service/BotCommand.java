package org.sjsu.botworker.service;

import org.sjsu.botworker.exception.BotCommandException;
import org.sjsu.botworker.model.dto.BotResponse;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Every command the botworker accepts over the broker, keyed by its wire name.
 */
public enum BotCommand {

    PING("ping", true) {
        @Override
        BotResponse execute(BotWorker worker, CommandArguments arguments) {
            return worker.ping();
        }
    },

    INITIALIZE_PARTICIPANT("initialize_participant", false, "participant_code") {
        @Override
        BotResponse execute(BotWorker worker, CommandArguments arguments) {
            return worker.initializeParticipant(arguments.getString("participant_code"));
        }
    },

    PREPARE_NEXT_SUBMIT("prepare_next_submit", false, "participant_code", "path", "html") {
        @Override
        BotResponse execute(BotWorker worker, CommandArguments arguments) {
            return worker.prepareNextSubmit(arguments.getString("participant_code"),
                    arguments.getString("path"), arguments.getString("html"));
        }
    },

    CONSUME_NEXT_SUBMIT("consume_next_submit", false, "participant_code") {
        @Override
        BotResponse execute(BotWorker worker, CommandArguments arguments) {
            return BotResponse.of(worker.consumeNextSubmit(arguments.getString("participant_code")));
        }
    },

    CLEAR_ALL("clear_all", false) {
        @Override
        BotResponse execute(BotWorker worker, CommandArguments arguments) {
            worker.clearAll();
            return BotResponse.empty();
        }
    };

    private final String wireName;
    private final boolean varArgs;
    private final List<String> parameters;

    BotCommand(String wireName, boolean varArgs, String... parameters) {
        this.wireName = wireName;
        this.varArgs = varArgs;
        this.parameters = List.of(parameters);
    }

    public String getWireName() {
        return wireName;
    }

    public static BotCommand fromWireName(String wireName) {
        return Arrays.stream(values())
                .filter(command -> command.wireName.equals(wireName))
                .findFirst()
                .orElseThrow(() -> new BotCommandException("Unknown botworker command: " + wireName));
    }

    public BotResponse invoke(BotWorker worker, List<Object> args, Map<String, Object> kwargs) {
        return execute(worker, CommandArguments.bind(wireName, parameters, varArgs, args, kwargs));
    }

    abstract BotResponse execute(BotWorker worker, CommandArguments arguments);
}
