package com.zerodayguardian.passwordrisk.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.zerodayguardian.passwordrisk.analysis.AnalysisRequest;
import com.zerodayguardian.passwordrisk.analysis.AnalysisResult;
import com.zerodayguardian.passwordrisk.analysis.PasswordAnalyzer;
import com.zerodayguardian.passwordrisk.api.AnalysisResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.Console;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.function.Supplier;

/**
 * One-shot command-line analysis, active under the {@code cli} profile.
 *
 * <pre>
 * java -jar password-risk-engine.jar --spring.profiles.active=cli [--password=VALUE] [--hibp]
 * </pre>
 *
 * <p>
 * Without {@code --password} the password is read from the console with echo
 * disabled, or as one line from standard input when input is piped. Passing
 * it on the command line is discouraged on shared systems.
 * </p>
 *
 * @author Naveed Gung
 */
@Component
@Profile("cli")
public class PasswordAnalyzerCli implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(PasswordAnalyzerCli.class);

    static final String PASSWORD_OPTION = "password";
    static final String HIBP_OPTION = "hibp";

    private final PasswordAnalyzer analyzer;
    private final ObjectMapper objectMapper;
    private final Supplier<String> passwordPrompt;
    private final PrintStream out;

    public PasswordAnalyzerCli(PasswordAnalyzer analyzer, ObjectMapper objectMapper) {
        this(analyzer, objectMapper, () -> readPassword(System.console(), System.in), System.out);
    }

    PasswordAnalyzerCli(
            PasswordAnalyzer analyzer,
            ObjectMapper objectMapper,
            Supplier<String> passwordPrompt,
            PrintStream out) {
        this.analyzer = analyzer;
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        this.passwordPrompt = passwordPrompt;
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) throws JsonProcessingException {
        String password = passwordFrom(args);
        boolean hibp = args.containsOption(HIBP_OPTION);

        AnalysisResult result = analyzer.analyzeBlocking(new AnalysisRequest(password, hibp));
        out.println(objectMapper.writeValueAsString(AnalysisResponse.from(result)));
    }

    private String passwordFrom(ApplicationArguments args) {
        List<String> values = args.getOptionValues(PASSWORD_OPTION);
        if (values != null && !values.isEmpty()) {
            return values.get(0);
        }
        return passwordPrompt.get();
    }

    /**
     * Prompt on the console with echo disabled, or read one line from
     * {@code stdin} when no console is attached (piped input).
     */
    static String readPassword(Console console, InputStream stdin) {
        if (console != null) {
            char[] chars = console.readPassword("Enter password to analyze: ");
            return chars != null ? new String(chars) : null;
        }
        log.warn("No console available, reading the password from standard input");
        // Not closed: the stream belongs to the caller.
        BufferedReader reader = new BufferedReader(new InputStreamReader(stdin, StandardCharsets.UTF_8));
        try {
            return reader.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read password from standard input", e);
        }
    }
}
