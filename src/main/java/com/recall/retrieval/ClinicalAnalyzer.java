package com.recall.retrieval;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.CharArraySet;
import org.apache.lucene.analysis.LowerCaseFilter;
import org.apache.lucene.analysis.StopFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.core.WhitespaceTokenizer;
import org.apache.lucene.analysis.miscellaneous.LengthFilter;
import org.apache.lucene.analysis.pattern.PatternReplaceFilter;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * ClinicalAnalyzer - Lucene chain shared by corpus and query tokens:
 * whitespace split, lowercase, strip punctuation, drop tokens shorter than three
 * characters, then optionally drop stop words.
 */
public class ClinicalAnalyzer extends Analyzer {

    public static final CharArraySet STOP_WORDS = CharArraySet.unmodifiableSet(new CharArraySet(Arrays.asList(
        "the", "a", "an", "and", "or", "but", "in", "on", "at", "to", "for", "of", "with", "by",
        "is", "are", "was", "were", "be", "been", "have", "has", "had", "do", "does", "did",
        "will", "would", "could", "should", "may", "might", "can", "this", "that", "these", "those",
        "i", "you", "he", "she", "it", "we", "they", "me", "him", "her", "us", "them"), false));

    private static final Pattern PUNCTUATION = Pattern.compile("[^\\w]");
    private static final int MIN_TOKEN_LENGTH = 3;

    private final boolean removeStopWords;

    public ClinicalAnalyzer(boolean removeStopWords) {
        this.removeStopWords = removeStopWords;
    }

    @Override
    protected TokenStreamComponents createComponents(String fieldName) {
        Tokenizer source = new WhitespaceTokenizer();
        TokenStream stream = new LowerCaseFilter(source);
        stream = new PatternReplaceFilter(stream, PUNCTUATION, "", true);
        stream = new LengthFilter(stream, MIN_TOKEN_LENGTH, Integer.MAX_VALUE);
        if (removeStopWords) {
            stream = new StopFilter(stream, STOP_WORDS);
        }
        return new TokenStreamComponents(source, stream);
    }

    public List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return tokens;
        }
        try (TokenStream stream = tokenStream("text", text)) {
            CharTermAttribute term = stream.addAttribute(CharTermAttribute.class);
            stream.reset();
            while (stream.incrementToken()) {
                tokens.add(term.toString());
            }
            stream.end();
        } catch (IOException e) {
            throw new UncheckedIOException("Tokenization failed", e);
        }
        return tokens;
    }
}
