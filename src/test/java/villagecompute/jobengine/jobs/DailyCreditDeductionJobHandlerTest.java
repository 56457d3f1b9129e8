package villagecompute.jobengine.jobs;

import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.test.common.QuarkusTestResource;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;
import villagecompute.jobengine.BaseIntegrationTest;
import villagecompute.jobengine.data.models.CreditAccount;
import villagecompute.jobengine.data.models.CreditTransaction;
import villagecompute.jobengine.data.models.Job;
import villagecompute.jobengine.exceptions.PermanentExecutionException;
import villagecompute.jobengine.testing.H2TestResource;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@QuarkusTest
@QuarkusTestResource(H2TestResource.class)
class DailyCreditDeductionJobHandlerTest extends BaseIntegrationTest {

    @Inject
    DailyCreditDeductionJobHandler handler;

    private Long createAccount(String tenantId, String balance, String dailyRate, LocalDate lastDeductedOn) {
        return QuarkusTransaction.requiringNew().call(() -> {
            CreditAccount account = new CreditAccount();
            account.tenantId = tenantId;
            account.balance = new BigDecimal(balance);
            account.dailyRate = new BigDecimal(dailyRate);
            account.lastDeductedOn = lastDeductedOn;
            account.updatedAt = Instant.now();
            account.persist();
            return account.id;
        });
    }

    private Map<String, Object> run(String billingDay) {
        Job job = Job.inline(null, DailyCreditDeductionJobHandler.TYPE,
                billingDay == null ? Map.of() : Map.of("billing_day", billingDay), Map.of(), Instant.now());
        return handler.execute(job, new InlineJobContext(null, DailyCreditDeductionJobHandler.TYPE));
    }

    private CreditAccount reloadAccount(Long id) {
        return QuarkusTransaction.requiringNew().call(() -> CreditAccount.<CreditAccount> findById(id));
    }

    @Test
    void testDeductsEachDueAccountOnce() {
        Long payer = createAccount(TENANT, "100.00", "2.50", null);
        Long other = createAccount(OTHER_TENANT, "10.00", "1.00", LocalDate.parse("2024-01-31"));

        Map<String, Object> result = run("2024-02-01");

        assertEquals("2024-02-01", result.get("billing_day"));
        assertEquals(2, result.get("accounts_due"));
        assertEquals(2, result.get("accounts_debited"));
        assertEquals(0, new BigDecimal("97.50").compareTo(reloadAccount(payer).balance));
        assertEquals(0, new BigDecimal("9.00").compareTo(reloadAccount(other).balance));
        assertEquals(LocalDate.parse("2024-02-01"), reloadAccount(payer).lastDeductedOn);

        List<CreditTransaction> ledger = QuarkusTransaction.requiringNew()
                .call(() -> CreditTransaction.findByTenant(TENANT));
        assertEquals(1, ledger.size());
        CreditTransaction entry = ledger.get(0);
        assertEquals(CreditTransaction.KIND_DAILY_DEDUCTION, entry.kind);
        assertEquals(0, new BigDecimal("-2.50").compareTo(entry.amount));
        assertEquals(0, new BigDecimal("97.50").compareTo(entry.balanceAfter));
        assertEquals(LocalDate.parse("2024-02-01"), entry.billingDay);
    }

    @Test
    void testSecondRunSameDayDebitsNothing() {
        Long payer = createAccount(TENANT, "5.00", "2.00", null);

        run("2024-02-01");
        Map<String, Object> again = run("2024-02-01");

        assertEquals(0, again.get("accounts_debited"));
        assertEquals(0, new BigDecimal("3.00").compareTo(reloadAccount(payer).balance));
        assertEquals(1, QuarkusTransaction.requiringNew().call(() -> CreditTransaction.findByTenant(TENANT)).size());

        run("2024-02-02");
        run("2024-02-03");
        CreditAccount overdrawn = reloadAccount(payer);
        assertEquals(0, new BigDecimal("-1.00").compareTo(overdrawn.balance));
    }

    @Test
    void testZeroRateAccountsSkipped() {
        Long free = createAccount(TENANT, "5.00", "0", null);

        Map<String, Object> result = run("2024-02-01");

        assertEquals(0, result.get("accounts_due"));
        assertEquals(0, new BigDecimal("5.00").compareTo(reloadAccount(free).balance));
    }

    @Test
    void testInvalidBillingDayIsPermanent() {
        assertThrows(PermanentExecutionException.class, () -> run("yesterday"));
    }
}
