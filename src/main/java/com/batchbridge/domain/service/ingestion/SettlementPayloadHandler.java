package com.batchbridge.domain.service.ingestion;

import com.batchbridge.domain.model.IngestContext;
import com.batchbridge.domain.model.NotificationType;
import com.batchbridge.domain.model.PayloadType;
import com.batchbridge.domain.model.SettlementRecord;
import com.batchbridge.domain.model.UpsertOutcome;
import com.batchbridge.domain.service.delivery.WebhookEnqueuer;
import com.batchbridge.domain.service.intake.ChecksumCalculator;
import com.batchbridge.infrastructure.persistence.repository.SettlementRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Settlement batches, keyed by (merchant_id, business_date, batch_id).
 *
 * Columns: merchant_id, business_date, batch_id, currency, gross_amount,
 * fee_amount, net_amount, transaction_count and an optional revision.
 */
@Slf4j
@Component
public class SettlementPayloadHandler extends AbstractTabularPayloadHandler<SettlementRecord> {

    private static final Set<String> KEY_COLUMNS = Set.of("merchant_id", "business_date", "batch_id");

    private final SettlementRepository settlementRepository;
    private final WebhookEnqueuer webhookEnqueuer;
    private final ChecksumCalculator checksumCalculator;
    private final Clock clock;

    public SettlementPayloadHandler(TabularPayloadReader reader,
                                    SettlementRepository settlementRepository,
                                    WebhookEnqueuer webhookEnqueuer,
                                    ChecksumCalculator checksumCalculator,
                                    Clock clock) {
        super(reader);
        this.settlementRepository = settlementRepository;
        this.webhookEnqueuer = webhookEnqueuer;
        this.checksumCalculator = checksumCalculator;
        this.clock = clock;
    }

    @Override
    public PayloadType type() {
        return PayloadType.SETTLEMENT;
    }

    @Override
    protected String collectionField() {
        return "settlements";
    }

    @Override
    protected Set<String> requiredColumns() {
        return KEY_COLUMNS;
    }

    @Override
    protected String businessKeyOf(RowFields row) {
        return row.optional("merchant_id") + "/" + row.optional("business_date") + "/" + row.optional("batch_id");
    }

    @Override
    protected SettlementRecord toCandidate(int lineNumber, RowFields row) throws InvalidRecordException {
        String merchantId = row.required("merchant_id");
        LocalDate businessDate = row.date("business_date");
        String batchId = row.required("batch_id");
        String currency = row.currency("currency");
        BigDecimal gross = row.decimal("gross_amount");
        BigDecimal fee = row.decimal("fee_amount");
        BigDecimal net = row.decimal("net_amount");
        int transactionCount = row.nonNegativeInt("transaction_count");
        Long revision = row.optionalNonNegativeLong("revision");

        if (gross.subtract(fee).compareTo(net) != 0) {
            throw new InvalidRecordException("net_amount " + net.toPlainString()
                    + " does not equal gross_amount - fee_amount (" + gross.subtract(fee).toPlainString() + ")");
        }

        String canonical = String.join("|", merchantId, businessDate.toString(), batchId, currency,
                canonical(gross), canonical(fee), canonical(net), Integer.toString(transactionCount),
                String.valueOf(revision));

        return SettlementRecord.builder()
                .lineNumber(lineNumber)
                .merchantId(merchantId)
                .businessDate(businessDate)
                .batchId(batchId)
                .currency(currency)
                .grossAmount(gross)
                .feeAmount(fee)
                .netAmount(net)
                .transactionCount(transactionCount)
                .revision(revision)
                .contentHash(checksumCalculator.sha256Hex(canonical))
                .build();
    }

    @Override
    @Transactional
    public UpsertOutcome apply(SettlementRecord record, IngestContext context) {
        int changed = settlementRepository.upsert(
                UUID.randomUUID(),
                record.getMerchantId(),
                record.getBusinessDate(),
                record.getBatchId(),
                record.getCurrency(),
                record.getGrossAmount(),
                record.getFeeAmount(),
                record.getNetAmount(),
                record.getTransactionCount(),
                record.getRevision(),
                record.getContentHash(),
                context.getFileReference(),
                context.getPublishedAt(),
                clock.instant());

        if (changed == 0) {
            log.debug("Settlement {} unchanged", record.getBusinessKey());
            return UpsertOutcome.UNCHANGED;
        }

        webhookEnqueuer.enqueue(NotificationType.SETTLEMENT_UPSERTED,
                NotificationType.SETTLEMENT_UPSERTED.wireName() + ":" + record.getBusinessKey() + ":" + record.getContentHash(),
                toNotification(record, context));
        return UpsertOutcome.APPLIED;
    }

    private static Map<String, Object> toNotification(SettlementRecord record, IngestContext context) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("merchant_id", record.getMerchantId());
        data.put("business_date", record.getBusinessDate().toString());
        data.put("batch_id", record.getBatchId());
        data.put("currency", record.getCurrency());
        data.put("gross_amount", record.getGrossAmount().toPlainString());
        data.put("fee_amount", record.getFeeAmount().toPlainString());
        data.put("net_amount", record.getNetAmount().toPlainString());
        data.put("transaction_count", record.getTransactionCount());
        data.put("revision", record.getRevision());
        data.put("ingest_job_id", context.getJobId().toString());
        return data;
    }

    private static String canonical(BigDecimal value) {
        return value.stripTrailingZeros().toPlainString();
    }
}
