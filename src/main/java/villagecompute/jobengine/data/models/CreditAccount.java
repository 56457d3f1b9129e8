package villagecompute.jobengine.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Prepaid credit balance of a tenant, debited once per calendar day by the daily credit deduction job.
 *
 * <p>
 * {@code last_deducted_on} makes the deduction idempotent: the debit is a conditional update that only matches while
 * the column is still before the billing day.
 */
@Entity
@Table(
        name = "credit_accounts")
public class CreditAccount extends PanacheEntityBase {

    @Id
    @GeneratedValue(
            strategy = GenerationType.IDENTITY)
    @Column(
            nullable = false)
    public Long id;

    @Column(
            name = "tenant_id",
            nullable = false,
            unique = true)
    public String tenantId;

    @Column(
            nullable = false,
            precision = 19,
            scale = 4)
    public BigDecimal balance;

    @Column(
            name = "daily_rate",
            nullable = false,
            precision = 19,
            scale = 4)
    public BigDecimal dailyRate;

    @Column(
            name = "last_deducted_on")
    public LocalDate lastDeductedOn;

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt;

    public static Optional<CreditAccount> findByTenant(String tenantId) {
        return find("tenantId", tenantId).firstResultOptional();
    }

    /**
     * Accounts with a positive rate not yet billed for {@code day}.
     */
    public static List<CreditAccount> findDueForDeduction(LocalDate day) {
        return find("dailyRate > 0 AND (lastDeductedOn IS NULL OR lastDeductedOn < ?1) ORDER BY id ASC", day).list();
    }

    /**
     * Debits one day's rate if the account has not been billed for {@code day} yet.
     *
     * @return 1 if debited, 0 if already billed
     */
    public static int deductForDay(Long id, LocalDate day, Instant now) {
        return update("balance = balance - dailyRate, lastDeductedOn = ?1, updatedAt = ?2 "
                + "WHERE id = ?3 AND (lastDeductedOn IS NULL OR lastDeductedOn < ?1)", day, now, id);
    }
}
