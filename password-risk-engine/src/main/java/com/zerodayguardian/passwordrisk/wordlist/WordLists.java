package com.zerodayguardian.passwordrisk.wordlist;

import com.zerodayguardian.passwordrisk.config.PasswordAnalyzerConfig;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Bundled word lists: the dictionary used by the feature extractor and the
 * themed word bank used by the suggestion generator.
 *
 * <p>
 * Both are loaded once at startup and are read-only afterwards.
 * </p>
 *
 * @author Naveed Gung
 */
@Component
public class WordLists {

    private static final Logger log = LoggerFactory.getLogger(WordLists.class);

    private final PasswordAnalyzerConfig.Wordlists config;
    private final ResourceLoader resourceLoader;

    private volatile WordList dictionary = WordList.empty();
    private volatile WordList wordBank = WordList.empty();

    public WordLists(PasswordAnalyzerConfig analyzerConfig, ResourceLoader resourceLoader) {
        this.config = analyzerConfig.getWordlists();
        this.resourceLoader = resourceLoader;
    }

    /** Build directly from word lists, bypassing resource loading. */
    public static WordLists of(WordList dictionary, WordList wordBank) {
        WordLists lists = new WordLists(new PasswordAnalyzerConfig(), null);
        lists.dictionary = dictionary;
        lists.wordBank = wordBank;
        return lists;
    }

    @PostConstruct
    public void load() {
        dictionary = read(config.getDictionary());
        wordBank = read(config.getWordBank());
        log.info("Word lists loaded: dictionary={} words, word bank={} words",
                dictionary.size(), wordBank.size());
    }

    public WordList dictionary() {
        return dictionary;
    }

    public WordList wordBank() {
        return wordBank;
    }

    private WordList read(String location) {
        List<String> words = new ArrayList<>();
        LineResources.stream(resourceLoader.getResource(location), words::add);
        return new WordList(words);
    }
}
