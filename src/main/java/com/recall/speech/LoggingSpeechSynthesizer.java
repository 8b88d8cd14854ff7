package com.recall.speech;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * LoggingSpeechSynthesizer - Default synthesizer when no audio back end is wired:
 * writes what would have been spoken to the log.
 */
public class LoggingSpeechSynthesizer implements SpeechSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(LoggingSpeechSynthesizer.class);

    @Override
    public void speak(String sessionId, String text) {
        log.info("🔊 [{}] {}", sessionId, text);
    }

    @Override
    public String name() {
        return "log";
    }
}
