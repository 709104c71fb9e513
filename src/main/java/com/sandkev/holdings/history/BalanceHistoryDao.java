package com.sandkev.holdings.history;

import com.sandkev.holdings.valuation.PortfolioSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Timestamped snapshot rows: one per combined asset, one per location and one net value.
 * Only the balance fields are stored; cost-basis details never reach this table set.
 */
@Slf4j
@Repository
public class BalanceHistoryDao {

    private final JdbcTemplate jdbc;

    public BalanceHistoryDao(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Transactional
    public void save(PortfolioSnapshot snapshot, Instant asOf) {
        var ts = Timestamp.from(asOf);

        List<Object[]> assets = new ArrayList<>();
        snapshot.combined().forEach((asset, v) ->
                assets.add(new Object[]{ts, asset, v.amount(), v.usdValue(), v.percentageOfNetValue()}));
        jdbc.batchUpdate("""
                insert into balance_history (as_of, asset, amount, usd_value, pct_of_net)
                values (?, ?, ?, ?, ?)
                """, assets);

        List<Object[]> locations = new ArrayList<>();
        snapshot.location().forEach((source, v) ->
                locations.add(new Object[]{ts, source, v.usdValue(), v.percentageOfNetValue()}));
        jdbc.batchUpdate("""
                insert into location_history (as_of, location, usd_value, pct_of_net)
                values (?, ?, ?, ?)
                """, locations);

        jdbc.update("insert into net_value_history (as_of, net_usd) values (?, ?)", ts, snapshot.netUsd());
        log.debug("Saved balance snapshot at {}: {} assets, {} locations", asOf, assets.size(), locations.size());
    }

    /** Most recent net values, newest first. */
    public List<NetValuePoint> latestNetValues(int limit) {
        return jdbc.query("""
                select as_of, net_usd
                from net_value_history
                order by as_of desc
                limit ?
                """, (rs, i) -> new NetValuePoint(rs.getTimestamp(1).toInstant(), rs.getBigDecimal(2)),
                Math.max(limit, 0));
    }
}
