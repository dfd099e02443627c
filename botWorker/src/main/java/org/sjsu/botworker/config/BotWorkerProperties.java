package org.sjsu.botworker.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "botworker")
public class BotWorkerProperties {

    /** Prefix shared by every input and response channel name. */
    private String keyPrefix = "browser-bots";

    /** Characters a participant code may start with; one input channel per character. */
    private String charset = "abcdefghijklmnopqrstuvwxyz0123456789";

    /** Subset of the charset this worker listens on. Empty means the whole charset. */
    private String listenCharRange = "";

    /** Maximum number of bot sessions kept in memory. */
    private int sessionLimit = 50;

    /** Set to false to run the web app without browser bots (and without a botworker). */
    private boolean browserBotsEnabled = true;

    private Duration prepareTimeout = Duration.ofSeconds(3);
    private Duration consumeTimeout = Duration.ofSeconds(1);
    private Duration pingTimeout = Duration.ofSeconds(1);
    private Duration initializeTimeout = Duration.ofSeconds(1);

    /** Idle response queues are deleted by the broker after this long. */
    private Duration responseKeyTtl = Duration.ofSeconds(60);

    private String completionExchange = "browser-bots";

    private Listener listener = new Listener();

    @Data
    public static class Listener {
        private boolean enabled = false;
    }

    public String effectiveListenCharRange() {
        return listenCharRange == null || listenCharRange.isEmpty() ? charset : listenCharRange;
    }
}
