package com.flagship.finance_ledger.account;

import java.util.List;

/**
 * Built-in chart of accounts seeded on first start: Thai banks, e-wallets and credit
 * cards plus common income and expense categories.
 */
public final class DefaultChart {

    private static final List<ChartRow> ROWS = List.of(
        // Assets
        ChartRow.of("Cash", "asset"),
        ChartRow.of("Bank - KBank", "asset"),
        ChartRow.of("Bank - SCB", "asset"),
        ChartRow.of("Bank - Krungthai (KTB)", "asset"),
        ChartRow.of("Bank - Krungsri (BAY)", "asset"),
        ChartRow.of("Bank - Bangkok Bank (BBL)", "asset"),
        ChartRow.of("Bank - TMBThanachart (TTB)", "asset"),
        ChartRow.of("Bank - UOB Thailand", "asset"),
        ChartRow.of("Bank - CIMB Thai", "asset"),
        ChartRow.of("Bank - KKP", "asset"),
        ChartRow.of("Bank - GSB", "asset"),
        ChartRow.of("Bank - Other", "asset"),
        ChartRow.of("Wallet - TrueMoney", "asset"),
        ChartRow.of("Wallet - Rabbit LINE Pay", "asset"),
        ChartRow.of("Wallet - AirPay", "asset"),
        ChartRow.of("Wallet - PromptPay", "asset"),
        ChartRow.of("Wallet - PayPal", "asset"),
        ChartRow.of("Wallet - Alipay", "asset"),
        ChartRow.of("Wallet - WeChat Pay", "asset"),
        ChartRow.of("Wallet - ShopeePay", "asset"),
        ChartRow.of("Wallet - GrabPay", "asset"),
        ChartRow.of("Wallet - Other", "asset"),
        // Liabilities
        ChartRow.of("Credit Card - KBank", "liability"),
        ChartRow.of("Credit Card - SCB", "liability"),
        ChartRow.of("Credit Card - Krungsri (BAY/FirstChoice)", "liability"),
        ChartRow.of("Credit Card - KTC", "liability"),
        ChartRow.of("Credit Card - BBL", "liability"),
        ChartRow.of("Credit Card - UOB", "liability"),
        ChartRow.of("Credit Card - AEON", "liability"),
        ChartRow.of("Credit Card - Citi", "liability"),
        ChartRow.of("Credit Card - Other", "liability"),
        // Equity
        ChartRow.of("Opening Balance Equity", "equity"),
        // Income
        ChartRow.of("Salary", "income"),
        ChartRow.of("Allowance", "income"),
        ChartRow.of("Freelance / Side Income", "income"),
        ChartRow.of("Interest / Dividends", "income"),
        ChartRow.of("Gifts / Other Income", "income"),
        ChartRow.of("Refunds / Reimbursements", "income"),
        ChartRow.of("Sale of Assets", "income"),
        ChartRow.of("Tax Refund", "income"),
        ChartRow.of("Bonuses / Commissions", "income"),
        ChartRow.of("Investment Income", "income"),
        ChartRow.of("Rental Income", "income"),
        ChartRow.of("Cashback / Rewards", "income"),
        ChartRow.of("Other Miscellaneous Income", "income"),
        // Expenses
        ChartRow.of("Food & Dining", "expense"),
        ChartRow.of("Transportation", "expense"),
        ChartRow.of("Rent", "expense"),
        ChartRow.of("Utilities", "expense"),
        ChartRow.of("Groceries", "expense"),
        ChartRow.of("Shopping", "expense"),
        ChartRow.of("Health & Fitness", "expense"),
        ChartRow.of("Entertainment", "expense"),
        ChartRow.of("Travel", "expense")
    );

    private DefaultChart() {
    }

    public static List<ChartRow> rows() {
        return ROWS;
    }
}
