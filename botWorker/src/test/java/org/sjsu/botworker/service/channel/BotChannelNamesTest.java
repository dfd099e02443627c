package org.sjsu.botworker.service.channel;

import org.junit.jupiter.api.Test;
import org.sjsu.botworker.config.BotWorkerProperties;
import org.sjsu.botworker.service.BotCommand;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BotChannelNamesTest {

    private final BotChannelNames names = new BotChannelNames(new BotWorkerProperties());

    @Test
    void shouldShardByFirstCharacter() {
        assertThat(names.inputChannel("abc123")).isEqualTo("browser-bots-a");
        assertThat(names.inputChannel("9xyz")).isEqualTo("browser-bots-9");
        assertThatThrownBy(() -> names.inputChannel("")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldNameResponseKeyAfterCommandAndParticipant() {
        assertThat(names.responseKey(BotCommand.PREPARE_NEXT_SUBMIT, "abc123"))
                .isEqualTo("browser-bots-prepare_next_submit-abc123");
    }

    @Test
    void shouldListenOnWholeCharsetByDefault() {
        assertThat(names.listenChannels()).hasSize(36).contains("browser-bots-a", "browser-bots-0");
    }

    @Test
    void shouldListenOnConfiguredRange() {
        BotWorkerProperties properties = new BotWorkerProperties();
        properties.setListenCharRange("abca");

        assertThat(new BotChannelNames(properties).listenChannels())
                .containsExactly("browser-bots-a", "browser-bots-b", "browser-bots-c");
    }

    @Test
    void shouldExposeListenChannelsAsQueueNames() {
        BotWorkerProperties properties = new BotWorkerProperties();
        properties.setListenCharRange("q7");

        assertThat(new BotChannelNames(properties).listenChannelNames())
                .containsExactly("browser-bots-q", "browser-bots-7");
    }

    @Test
    void shouldTellInputChannelsFromResponseKeys() {
        assertThat(names.isInputChannel("browser-bots-q")).isTrue();
        assertThat(names.isInputChannel("browser-bots-ping-q1")).isFalse();
        assertThat(names.isInputChannel("browser-bots-Q")).isFalse();
        assertThat(names.isInputChannel("other-q")).isFalse();
    }
}
