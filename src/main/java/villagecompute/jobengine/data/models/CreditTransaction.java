package villagecompute.jobengine.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Ledger row for a credit movement. Daily deductions are unique per account and billing day.
 */
@Entity
@Table(
        name = "credit_transactions",
        uniqueConstraints = @UniqueConstraint(
                name = "uq_credit_tx_account_day_kind",
                columnNames = {"account_id", "billing_day", "kind"}))
public class CreditTransaction extends PanacheEntityBase {

    public static final String KIND_DAILY_DEDUCTION = "daily_deduction";

    @Id
    @GeneratedValue(
            strategy = GenerationType.IDENTITY)
    @Column(
            nullable = false)
    public Long id;

    @Column(
            name = "account_id",
            nullable = false)
    public Long accountId;

    @Column(
            name = "tenant_id",
            nullable = false)
    public String tenantId;

    @Column(
            nullable = false)
    public String kind;

    @Column(
            nullable = false,
            precision = 19,
            scale = 4)
    public BigDecimal amount;

    @Column(
            name = "balance_after",
            nullable = false,
            precision = 19,
            scale = 4)
    public BigDecimal balanceAfter;

    @Column(
            name = "billing_day",
            nullable = false)
    public LocalDate billingDay;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    public static List<CreditTransaction> findByTenant(String tenantId) {
        return find("tenantId = ?1 ORDER BY createdAt ASC, id ASC", tenantId).list();
    }
}
