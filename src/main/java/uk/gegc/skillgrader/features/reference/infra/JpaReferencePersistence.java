package uk.gegc.skillgrader.features.reference.infra;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Slice;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.skillgrader.features.reference.application.ReferencePersistence;
import uk.gegc.skillgrader.features.reference.domain.model.ReferenceAnswer;
import uk.gegc.skillgrader.features.reference.domain.model.ReferenceFilter;
import uk.gegc.skillgrader.features.reference.domain.model.ReferenceSourceKind;
import uk.gegc.skillgrader.features.reference.domain.repository.ReferenceAnswerRepository;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Component
public class JpaReferencePersistence implements ReferencePersistence {

    static final int SCAN_PAGE_SIZE = 200;

    // ascending, so rows inserted mid-scan land on later pages instead of shifting earlier ones
    private static final Sort SCAN_ORDER = Sort.by("createdAt").ascending().and(Sort.by("id").ascending());

    private final ReferenceAnswerRepository referenceAnswerRepository;
    private final int scanPageSize;

    @Autowired
    public JpaReferencePersistence(ReferenceAnswerRepository referenceAnswerRepository) {
        this(referenceAnswerRepository, SCAN_PAGE_SIZE);
    }

    JpaReferencePersistence(ReferenceAnswerRepository referenceAnswerRepository, int scanPageSize) {
        this.referenceAnswerRepository = referenceAnswerRepository;
        this.scanPageSize = scanPageSize;
    }

    @Override
    @Transactional(readOnly = true)
    public List<ReferenceAnswer> findByExercise(String exerciseId, int minScore) {
        List<ReferenceAnswer> references = new ArrayList<>();
        Pageable page = PageRequest.of(0, scanPageSize, SCAN_ORDER);
        Slice<ReferenceAnswer> slice;
        do {
            slice = referenceAnswerRepository.findByExerciseIdAndActiveTrueAndScoreGreaterThanEqual(
                    exerciseId, minScore, page);
            references.addAll(slice.getContent());
            page = slice.nextPageable();
        } while (slice.hasNext());
        return references;
    }

    @Override
    @Transactional(readOnly = true)
    public List<ReferenceAnswer> findCrossExercise(String skillCategory, String excludeExerciseId, ReferenceFilter filter) {
        if (skillCategory == null || skillCategory.isBlank()) {
            return List.of();
        }
        return referenceAnswerRepository.findCrossExercise(
                skillCategory, excludeExerciseId, filter.minScore(), PageRequest.of(0, filter.limit()));
    }

    @Override
    @Transactional
    public UUID insert(ReferenceAnswer reference) {
        return referenceAnswerRepository.save(reference).getId();
    }

    @Override
    @Transactional
    public boolean markVerified(UUID id, boolean promoteToCurated) {
        return referenceAnswerRepository.findById(id)
                .map(reference -> {
                    reference.setVerified(true);
                    if (promoteToCurated) {
                        reference.setSourceKind(ReferenceSourceKind.CURATED);
                    }
                    return true;
                })
                .orElse(false);
    }

    @Override
    @Transactional
    public boolean deactivate(UUID id) {
        return referenceAnswerRepository.findById(id)
                .map(reference -> {
                    reference.setActive(false);
                    return true;
                })
                .orElse(false);
    }

    @Override
    @Transactional(readOnly = true)
    public Map<String, Long> countActiveByExercise() {
        Map<String, Long> counts = new LinkedHashMap<>();
        referenceAnswerRepository.countActiveGroupedByExercise()
                .forEach(row -> counts.put(row.getExerciseId(), row.getTotal()));
        return counts;
    }
}
