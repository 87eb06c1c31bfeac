package com.investbyyourself.etl.service.transform;

import java.math.BigDecimal;
import java.util.List;

import static com.investbyyourself.etl.service.transform.RatioMetricCalculator.percent;
import static com.investbyyourself.etl.service.transform.RatioMetricCalculator.ratio;

/**
 * Default profitability, liquidity, leverage and valuation ratios.
 */
public final class StandardMetricCalculators {

    private static final BigDecimal ZERO = BigDecimal.ZERO;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal THOUSAND = BigDecimal.valueOf(1000);

    private StandardMetricCalculators() {
    }

    public static List<MetricCalculator> all() {
        return List.of(
                percent("gross_margin", "profitability", "gross_profit", "revenue", THOUSAND.negate(), HUNDRED),
                percent("operating_margin", "profitability", "operating_income", "revenue", THOUSAND.negate(), HUNDRED),
                percent("net_margin", "profitability", "net_income", "revenue", THOUSAND.negate(), HUNDRED),
                percent("return_on_equity", "profitability", "net_income", "total_equity", THOUSAND.negate(), THOUSAND),
                percent("return_on_assets", "profitability", "net_income", "total_assets", HUNDRED.negate(), HUNDRED),
                ratio("current_ratio", "liquidity", "current_assets", "current_liabilities", ZERO, HUNDRED),
                new RatioMetricCalculator("quick_ratio", "liquidity", List.of("current_assets", "inventory"),
                        "current_liabilities", "ratio", BigDecimal.ONE, ZERO, HUNDRED),
                ratio("debt_to_equity", "leverage", "total_debt", "total_equity", ZERO, HUNDRED),
                ratio("price_to_earnings", "valuation", "price", "eps", THOUSAND.negate(), THOUSAND),
                ratio("price_to_book", "valuation", "price", "book_value_per_share", ZERO, THOUSAND),
                ratio("price_to_sales", "valuation", "market_cap", "revenue", ZERO, THOUSAND),
                ratio("ev_to_ebitda", "valuation", "enterprise_value", "ebitda", THOUSAND.negate(), THOUSAND),
                percent("dividend_yield", "valuation", "dividend_per_share", "price", ZERO, HUNDRED));
    }
}
