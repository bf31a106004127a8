package dev.careeriq.controller;

import dev.careeriq.dto.AnalysisRequest;
import dev.careeriq.dto.ResultEnvelope;
import dev.careeriq.dto.VocabularyInfo;
import dev.careeriq.model.RoleCatalog;
import dev.careeriq.model.RoleProfile;
import dev.careeriq.model.SkillDefinition;
import dev.careeriq.model.SkillVocabulary;
import dev.careeriq.service.ResumeAnalysisService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Resume analysis endpoint. The resume arrives already parsed by the upload collaborator.
 */
@RestController
@RequestMapping("/api/v1/analysis")
@Tag(name = "Analysis", description = "Resume to job description matching")
@RequiredArgsConstructor
@Slf4j
public class AnalysisController {

    private final ResumeAnalysisService resumeAnalysisService;
    private final SkillVocabulary skillVocabulary;
    private final RoleCatalog roleCatalog;

    @PostMapping
    @Operation(summary = "Analyze resume", description = "Match a parsed resume against a job description")
    public Mono<ResultEnvelope> analyze(@Valid @RequestBody AnalysisRequest request) {
        // Sizes only: resume and job text are personal data
        log.debug("Analysis requested (resume text {} chars, job text {} chars, role hint present={})",
                length(request.getResumeText()), length(request.getJobDescription()),
                request.getTargetRole() != null);
        return resumeAnalysisService.analyze(request);
    }

    @GetMapping("/vocabulary")
    @Operation(summary = "Vocabulary info", description = "Version and size of the loaded skill vocabulary and role catalog")
    public Mono<VocabularyInfo> vocabulary() {
        return Mono.just(new VocabularyInfo(
                skillVocabulary.getVersion(),
                skillVocabulary.size(),
                skillVocabulary.surfaceFormCount(),
                skillVocabulary.getSkills().stream().map(SkillDefinition::category).distinct().sorted().toList(),
                roleCatalog.getRoles().stream().map(RoleProfile::name).toList(),
                roleCatalog.getDefaultRole()));
    }

    private static int length(String text) {
        return text == null ? 0 : text.length();
    }
}
