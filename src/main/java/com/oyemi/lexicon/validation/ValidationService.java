package com.oyemi.lexicon.validation;

import com.oyemi.lexicon.config.LexiconProperties;
import com.oyemi.lexicon.dto.ValidationReport;
import com.oyemi.lexicon.entity.LemmaBaseForm;
import com.oyemi.lexicon.model.LexiconRow;
import com.oyemi.lexicon.repository.LemmaBaseFormRepository;
import com.oyemi.lexicon.repository.LexiconEntryRepository;
import com.oyemi.lexicon.service.LexiconPipeline;
import com.oyemi.lexicon.source.BaseFormResolver;
import com.oyemi.lexicon.source.KnowledgeBase;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Validates the stored artifact against a fresh in-memory rebuild from the same knowledge base.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ValidationService {

    private final LexiconEntryRepository lexiconEntryRepository;
    private final LemmaBaseFormRepository lemmaBaseFormRepository;
    private final LexiconPipeline pipeline;
    private final KnowledgeBase knowledgeBase;
    private final BaseFormResolver baseFormResolver;
    private final LexiconValidator validator;
    private final LexiconProperties properties;

    @Transactional(readOnly = true)
    public ValidationReport validate() {
        List<LexiconRow> stored = lexiconEntryRepository.findAllByOrderByWordAscCodeAsc().stream()
                .map(entry -> new LexiconRow(entry.getWord(), entry.getCode(), entry.getPriority()))
                .toList();
        Map<String, String> baseForms = lemmaBaseFormRepository.findAll().stream()
                .collect(Collectors.toMap(LemmaBaseForm::getWord, LemmaBaseForm::getLemma));
        log.info("Validating {} stored rows", stored.size());

        List<LexiconRow> rebuilt = pipeline.run(knowledgeBase, baseFormResolver).finalSnapshot().entries().stream()
                .map(LexiconRow::of)
                .toList();

        ValidationReport report = validator.validate(new ValidationContext(
                stored, rebuilt, baseForms, properties.getProbeWords(), properties.getTopSuperclasses()));
        if (report.isPassed()) {
            log.info("Validation PASSED: {} words, {} mappings", report.getWords(), report.getMappings());
        } else {
            log.error("Validation FAILED: {} issue(s)", report.allIssues().size());
        }
        return report;
    }
}
