package com.flagship.settlement_engine.balance;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;

/**
 * Aggregates over the history tables, used to rebuild a balance from scratch.
 *
 * outstanding = platform commissions owed − subtotals of paid invoices − offsets received as debtor
 * pending     = referral shares earned − payouts not failed − offsets given as creditor
 */
@Repository
@RequiredArgsConstructor
public class BalanceHistoryQueries {

    private final JdbcTemplate jdbcTemplate;

    public BigDecimal platformCommissionsOwed(String professionalId) {
        return sum(
            "SELECT COALESCE(SUM(amount), 0) FROM commission_facts " +
            "WHERE payer_professional_id = ? AND recipient_type = 'PLATFORM'",
            professionalId);
    }

    public BigDecimal paidInvoiceSubtotals(String professionalId) {
        return sum(
            "SELECT COALESCE(SUM(subtotal), 0) FROM invoices " +
            "WHERE professional_id = ? AND status = 'PAID'",
            professionalId);
    }

    public BigDecimal offsetsSettledAsDebtor(String professionalId) {
        return sum(
            "SELECT COALESCE(SUM(offset_amount), 0) FROM balance_offsets WHERE professional_b_id = ?",
            professionalId);
    }

    public BigDecimal revenueSharesEarned(String professionalId) {
        return sum(
            "SELECT COALESCE(SUM(amount), 0) FROM commission_facts " +
            "WHERE recipient_id = ? AND recipient_type = 'REFERRER'",
            professionalId);
    }

    public BigDecimal payoutsNotFailed(String professionalId) {
        return sum(
            "SELECT COALESCE(SUM(amount), 0) FROM payouts WHERE professional_id = ? AND status <> 'FAILED'",
            professionalId);
    }

    public BigDecimal offsetsReleasedAsCreditor(String professionalId) {
        return sum(
            "SELECT COALESCE(SUM(offset_amount), 0) FROM balance_offsets WHERE professional_a_id = ?",
            professionalId);
    }

    private BigDecimal sum(String sql, String professionalId) {
        BigDecimal value = jdbcTemplate.queryForObject(sql, BigDecimal.class, professionalId);
        return value != null ? value : BigDecimal.ZERO;
    }
}
