package com.zerodayguardian.passwordrisk.api;

import com.zerodayguardian.passwordrisk.analysis.AnalysisRequest;
import com.zerodayguardian.passwordrisk.analysis.PasswordAnalyzer;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * HTTP entry point for backend password validators.
 *
 * @author Naveed Gung
 */
@RestController
@RequestMapping("/api/v1/passwords")
public class PasswordAnalysisController {

    private final PasswordAnalyzer analyzer;

    public PasswordAnalysisController(PasswordAnalyzer analyzer) {
        this.analyzer = analyzer;
    }

    @PostMapping("/analyze")
    public Mono<AnalysisResponse> analyze(@Valid @RequestBody AnalysisRequest request) {
        return analyzer.analyze(request).map(AnalysisResponse::from);
    }
}
