/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.jobengine.jobs;

import io.quarkus.narayana.jta.QuarkusTransaction;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;
import villagecompute.jobengine.data.models.CreditAccount;
import villagecompute.jobengine.data.models.CreditTransaction;
import villagecompute.jobengine.data.models.Job;
import villagecompute.jobengine.exceptions.PermanentExecutionException;
import villagecompute.jobengine.util.PayloadValues;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Debits every credit account by its daily rate, once per UTC calendar day.
 *
 * <p>
 * Runs inline from the {@code system:daily_credit_deduction} schedule at 00:00 UTC. Each account is debited in its own
 * transaction with a conditional update on {@code last_deducted_on}, and the ledger row is unique per account and
 * billing day, so a re-run or a manual execution on the same day debits nothing twice.
 *
 * <p>
 * <b>Payload Structure:</b>
 *
 * <pre>
 * {
 *   "billing_day": "2024-01-01"  // optional, defaults to today (UTC)
 * }
 * </pre>
 */
@ApplicationScoped
public class DailyCreditDeductionJobHandler implements JobHandler {

    private static final Logger LOG = Logger.getLogger(DailyCreditDeductionJobHandler.class);

    public static final String TYPE = "system:daily_credit_deduction";

    @Override
    public String handlesType() {
        return TYPE;
    }

    @Override
    public ExecutionMode executionMode() {
        return ExecutionMode.INLINE;
    }

    @Override
    public String description() {
        return "Deducts each tenant's daily credit rate once per UTC day";
    }

    @Override
    public Map<String, Object> execute(Job job, JobContext context) {
        LocalDate day = billingDay(job);
        List<Long> accountIds = QuarkusTransaction.requiringNew().call(() -> CreditAccount
                .findDueForDeduction(day).stream().map(account -> account.id).toList());
        LOG.infof("Deducting daily credits for %s: %d accounts due", day, accountIds.size());

        int deducted = 0;
        for (int i = 0; i < accountIds.size(); i++) {
            Long accountId = accountIds.get(i);
            boolean debited = QuarkusTransaction.requiringNew().call(() -> deductOne(accountId, day));
            if (debited) {
                deducted++;
            }
            context.updateProgress((i + 1) * 100 / accountIds.size(), "Processed " + (i + 1) + " accounts");
        }

        LOG.infof("Daily credit deduction for %s finished: %d of %d accounts debited", day, deducted,
                accountIds.size());
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("billing_day", day.toString());
        result.put("accounts_due", accountIds.size());
        result.put("accounts_debited", deducted);
        return result;
    }

    private static boolean deductOne(Long accountId, LocalDate day) {
        Instant now = Instant.now();
        if (CreditAccount.deductForDay(accountId, day, now) == 0) {
            LOG.debugf("Credit account %d already billed for %s", accountId, day);
            return false;
        }
        CreditAccount account = CreditAccount.findById(accountId);
        CreditAccount.getEntityManager().refresh(account);

        CreditTransaction entry = new CreditTransaction();
        entry.accountId = account.id;
        entry.tenantId = account.tenantId;
        entry.kind = CreditTransaction.KIND_DAILY_DEDUCTION;
        entry.amount = account.dailyRate.negate();
        entry.balanceAfter = account.balance;
        entry.billingDay = day;
        entry.createdAt = now;
        entry.persist();

        if (account.balance.compareTo(BigDecimal.ZERO) < 0) {
            LOG.warnf("Credit account %d of tenant %s is overdrawn: %s", account.id, account.tenantId,
                    account.balance);
        }
        return true;
    }

    private static LocalDate billingDay(Job job) {
        String value = PayloadValues.optionalString(job.payload, "billing_day", null);
        if (value == null || value.isBlank()) {
            return LocalDate.now(ZoneOffset.UTC);
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new PermanentExecutionException("Payload field 'billing_day' must be an ISO date", e);
        }
    }
}
