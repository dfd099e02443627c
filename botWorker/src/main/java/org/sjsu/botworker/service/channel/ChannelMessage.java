package org.sjsu.botworker.service.channel;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class ChannelMessage {
    private String channel;
    private String payload;
}
