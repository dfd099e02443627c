package org.sjsu.botworker.controller;

import org.sjsu.botworker.service.client.BrowserBotClient;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/browser-bots")
public class BrowserBotController {

    @Autowired
    private BrowserBotClient browserBotClient;

    @PostMapping("/participants/{participantCode}/initialize")
    public Map<String, Object> initialize(@PathVariable String participantCode) {
        boolean initialized = browserBotClient.initializeBot(participantCode);
        return Map.of("participantCode", participantCode, "initialized", initialized);
    }

    @GetMapping("/ping/{participantCode}")
    public Map<String, Object> ping(@PathVariable String participantCode) {
        browserBotClient.ping(participantCode);
        return Map.of("ok", true);
    }

    @DeleteMapping("/channels")
    public Map<String, Object> flush(@RequestParam(name = "charRange", required = false) String charRange) {
        return Map.of("deleted", browserBotClient.flushBots(charRange));
    }
}
