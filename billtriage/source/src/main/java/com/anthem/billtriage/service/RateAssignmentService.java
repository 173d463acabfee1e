package com.anthem.billtriage.service;

import com.anthem.billtriage.model.AssignmentMode;
import com.anthem.billtriage.model.AssignmentResult;
import com.anthem.billtriage.model.AssignmentValidationResult;
import com.anthem.billtriage.model.CategoryMap;
import com.anthem.billtriage.model.FailedBill;
import com.anthem.billtriage.model.RateAssignmentRequest;
import com.anthem.billtriage.model.ValidatedAssignment;
import com.anthem.billtriage.repository.CategoryMapRepository;
import com.anthem.billtriage.repository.FailedBillRepository;
import com.anthem.billtriage.repository.RateAssignmentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Rate assignment: load bill, validate, apply, persist, move the bill out of the failed set.
 *
 * The engine steps never leave partial state. The bill is moved in S3 only after the rate rows
 * commit: a rolled back write leaves the bill in the failed set, and a failed move after commit
 * leaves recorded rates with the bill still listed. At most one assignment per filename is
 * enforced by the {@code rate_assignment} primary key.
 */
@Service
public class RateAssignmentService {

    private static final Logger log = LoggerFactory.getLogger(RateAssignmentService.class);

    private final FailedBillRepository failedBillRepository;
    private final CategoryMapRepository categoryMapRepository;
    private final RateAssignmentRepository rateAssignmentRepository;
    private final RateAssignmentValidator validator;
    private final RateAssignmentApplier applier;

    public RateAssignmentService(
            FailedBillRepository failedBillRepository,
            CategoryMapRepository categoryMapRepository,
            RateAssignmentRepository rateAssignmentRepository,
            RateAssignmentValidator validator,
            RateAssignmentApplier applier) {
        this.failedBillRepository = failedBillRepository;
        this.categoryMapRepository = categoryMapRepository;
        this.rateAssignmentRepository = rateAssignmentRepository;
        this.validator = validator;
        this.applier = applier;
    }

    /**
     * Validate and apply a submission for one bill.
     *
     * @throws BillNotFoundException no failed bill has that filename
     * @throws RateAssignmentException the request was rejected or could not be applied
     * @throws AssignmentConflictException rates were already recorded for the bill
     */
    @Transactional
    public AssignmentOutcome assignRates(String filename, RateAssignmentRequest request) {
        log.info("Rate assignment requested: filename={}, mode={}",
                filename, request != null ? request.getMode() : null);

        FailedBill bill = failedBillRepository.findByFilename(filename)
                .orElseThrow(() -> new BillNotFoundException(filename));
        if (rateAssignmentRepository.exists(filename)) {
            log.warn("Rate assignment conflict: filename={}, already recorded", filename);
            throw new AssignmentConflictException(filename, null);
        }

        CategoryMap categoryMap = request != null && request.getCategoryRates() != null
                ? categoryMapRepository.load()
                : CategoryMap.empty();

        AssignmentValidationResult validation = validator.validate(request, bill, categoryMap);
        if (!validation.isValid()) {
            log.warn("Rate assignment rejected: filename={}, code={}, field={}, message={}",
                    filename, validation.getError().getCode(), validation.getError().getField(),
                    validation.getError().getMessage());
            throw new RateAssignmentException(validation.getError());
        }

        ValidatedAssignment assignment = validation.getAssignment();
        AssignmentResult result;
        try {
            result = applier.apply(assignment, bill, categoryMap);
        } catch (RateAssignmentException e) {
            log.warn("Rate assignment aborted: filename={}, code={}, message={}",
                    filename, e.getCode(), e.getMessage());
            throw e;
        }

        try {
            rateAssignmentRepository.save(result);
        } catch (DuplicateKeyException e) {
            log.warn("Rate assignment conflict: filename={}", filename);
            throw new AssignmentConflictException(filename, e);
        }
        moveAfterCommit(filename, result);

        log.info("[AUDIT] Rates assigned: filename={}, mode={}, updates={}, unresolved={}, categorySummary={}",
                filename, result.getMode(), result.getUpdatedRates().size(),
                result.getUnresolvedCodes(),
                result.getMode() == AssignmentMode.CATEGORY ? result.getCategorySummary() : "n/a");

        return new AssignmentOutcome(result, assignment.getWarnings());
    }

    private void moveAfterCommit(String filename, AssignmentResult result) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            markResolved(filename, result);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                markResolved(filename, result);
            }
        });
    }

    private void markResolved(String filename, AssignmentResult result) {
        try {
            failedBillRepository.markResolved(filename, result);
        } catch (RuntimeException e) {
            log.error("Rates recorded but bill not moved to resolved: filename={}", filename, e);
            throw e;
        }
        log.info("Bill moved to resolved: filename={}", filename);
    }
}
