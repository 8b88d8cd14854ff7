package com.recall.speech;

/**
 * SpeechSynthesizer - Boundary to the text-to-speech adapter. Each session is
 * handed its own instance; voice selection belongs to the implementation.
 */
public interface SpeechSynthesizer {

    void speak(String sessionId, String text);

    String name();
}
