package com.batchbridge.domain.service.ingestion;

import com.batchbridge.domain.model.DisputeRecord;
import com.batchbridge.domain.model.IngestContext;
import com.batchbridge.domain.model.NotificationType;
import com.batchbridge.domain.model.PayloadType;
import com.batchbridge.domain.model.UpsertOutcome;
import com.batchbridge.domain.service.delivery.WebhookEnqueuer;
import com.batchbridge.domain.service.intake.ChecksumCalculator;
import com.batchbridge.infrastructure.persistence.entity.DisputeEntity;
import com.batchbridge.infrastructure.persistence.repository.DisputeRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Dispute cases, keyed by (merchant_id, case_reference).
 */
@Slf4j
@Component
public class DisputePayloadHandler extends AbstractTabularPayloadHandler<DisputeRecord> {

    private static final Set<String> KEY_COLUMNS = Set.of("merchant_id", "case_reference");

    private final DisputeRepository disputeRepository;
    private final WebhookEnqueuer webhookEnqueuer;
    private final ChecksumCalculator checksumCalculator;
    private final Clock clock;

    public DisputePayloadHandler(TabularPayloadReader reader,
                                 DisputeRepository disputeRepository,
                                 WebhookEnqueuer webhookEnqueuer,
                                 ChecksumCalculator checksumCalculator,
                                 Clock clock) {
        super(reader);
        this.disputeRepository = disputeRepository;
        this.webhookEnqueuer = webhookEnqueuer;
        this.checksumCalculator = checksumCalculator;
        this.clock = clock;
    }

    @Override
    public PayloadType type() {
        return PayloadType.DISPUTE;
    }

    @Override
    protected String collectionField() {
        return "disputes";
    }

    @Override
    protected Set<String> requiredColumns() {
        return KEY_COLUMNS;
    }

    @Override
    protected String businessKeyOf(RowFields row) {
        return row.optional("merchant_id") + "/" + row.optional("case_reference");
    }

    @Override
    protected DisputeRecord toCandidate(int lineNumber, RowFields row) throws InvalidRecordException {
        String merchantId = row.required("merchant_id");
        String caseReference = row.required("case_reference");
        String transactionReference = row.optional("transaction_reference");
        BigDecimal amount = row.decimal("amount");
        String currency = row.currency("currency");
        String reasonCode = row.required("reason_code");
        String status = status(row.required("status"));
        LocalDate openedOn = row.date("opened_on");
        LocalDate respondBy = row.optionalDate("respond_by");
        Long revision = row.optionalNonNegativeLong("revision");

        if (amount.signum() <= 0) {
            throw new InvalidRecordException("amount must be positive: " + amount.toPlainString());
        }
        if (respondBy != null && respondBy.isBefore(openedOn)) {
            throw new InvalidRecordException("respond_by " + respondBy + " is before opened_on " + openedOn);
        }

        String canonical = String.join("|", merchantId, caseReference, String.valueOf(transactionReference),
                amount.stripTrailingZeros().toPlainString(), currency, reasonCode, status,
                openedOn.toString(), String.valueOf(respondBy), String.valueOf(revision));

        return DisputeRecord.builder()
                .lineNumber(lineNumber)
                .merchantId(merchantId)
                .caseReference(caseReference)
                .transactionReference(transactionReference)
                .amount(amount)
                .currency(currency)
                .reasonCode(reasonCode)
                .status(status)
                .openedOn(openedOn)
                .respondBy(respondBy)
                .revision(revision)
                .contentHash(checksumCalculator.sha256Hex(canonical))
                .build();
    }

    @Override
    @Transactional
    public UpsertOutcome apply(DisputeRecord record, IngestContext context) {
        int changed = disputeRepository.upsert(
                UUID.randomUUID(),
                record.getMerchantId(),
                record.getCaseReference(),
                record.getTransactionReference(),
                record.getAmount(),
                record.getCurrency(),
                record.getReasonCode(),
                record.getStatus(),
                record.getOpenedOn(),
                record.getRespondBy(),
                record.getRevision(),
                record.getContentHash(),
                context.getFileReference(),
                context.getPublishedAt(),
                clock.instant());

        if (changed == 0) {
            log.debug("Dispute {} unchanged", record.getBusinessKey());
            return UpsertOutcome.UNCHANGED;
        }

        webhookEnqueuer.enqueue(NotificationType.DISPUTE_UPSERTED,
                NotificationType.DISPUTE_UPSERTED.wireName() + ":" + record.getBusinessKey() + ":" + record.getContentHash(),
                toNotification(record, context));
        return UpsertOutcome.APPLIED;
    }

    private static String status(String value) throws InvalidRecordException {
        try {
            return DisputeEntity.DisputeStatus.valueOf(value.toUpperCase(Locale.ROOT)).name();
        } catch (IllegalArgumentException e) {
            throw new InvalidRecordException("unknown dispute status: " + value);
        }
    }

    private static Map<String, Object> toNotification(DisputeRecord record, IngestContext context) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("merchant_id", record.getMerchantId());
        data.put("case_reference", record.getCaseReference());
        data.put("transaction_reference", record.getTransactionReference());
        data.put("amount", record.getAmount().toPlainString());
        data.put("currency", record.getCurrency());
        data.put("reason_code", record.getReasonCode());
        data.put("status", record.getStatus());
        data.put("opened_on", record.getOpenedOn().toString());
        data.put("respond_by", record.getRespondBy() == null ? null : record.getRespondBy().toString());
        data.put("revision", record.getRevision());
        data.put("ingest_job_id", context.getJobId().toString());
        return data;
    }
}
