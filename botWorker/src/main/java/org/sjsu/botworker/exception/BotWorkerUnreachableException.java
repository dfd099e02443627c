package org.sjsu.botworker.exception;

/**
 * The liveness ping got no answer: no botworker is consuming the participant's channel.
 */
public class BotWorkerUnreachableException extends BotWorkerException {

    public static final String REMEDIATION =
            "Ping to botworker failed. "
                    + "If you want to use browser bots, you need to be running the botworker "
                    + "(start the app with botworker.listener.enabled=true). "
                    + "Otherwise, set botworker.browser-bots-enabled=false in application.yml.";

    public BotWorkerUnreachableException() {
        super(REMEDIATION);
    }
}
