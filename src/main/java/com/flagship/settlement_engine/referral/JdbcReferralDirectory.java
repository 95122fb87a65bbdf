package com.flagship.settlement_engine.referral;

import com.flagship.settlement_engine.commission.calculator.PenaltyProfile;
import com.flagship.settlement_engine.commission.calculator.ReferrerTier;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Reads the replicated {@code referral_profiles} table.
 *
 * The referral service owns this data; the engine only ever reads it.
 */
@Repository
public class JdbcReferralDirectory implements ReferralDirectory {

    private static final RowMapper<ReferralProfile> PROFILE_MAPPER = (rs, rowNum) -> new ReferralProfile(
        rs.getString("professional_id"),
        rs.getString("referred_by"),
        ReferrerTier.fromValue(rs.getString("tier")),
        new PenaltyProfile(
            rs.getInt("dispute_count"),
            rs.getInt("late_payment_count"),
            rs.getBigDecimal("quality_score")
        )
    );

    private final JdbcTemplate jdbcTemplate;

    public JdbcReferralDirectory(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<ReferralProfile> findProfile(String professionalId) {
        List<ReferralProfile> profiles = jdbcTemplate.query(
            "SELECT professional_id, referred_by, tier, dispute_count, late_payment_count, quality_score " +
            "FROM referral_profiles WHERE professional_id = ?",
            PROFILE_MAPPER,
            professionalId
        );
        return profiles.stream().findFirst();
    }
}
