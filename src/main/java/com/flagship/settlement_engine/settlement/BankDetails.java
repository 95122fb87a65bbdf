package com.flagship.settlement_engine.settlement;

import lombok.Value;

/**
 * Destination account of a bank transfer. SWIFT is only needed abroad.
 */
@Value
public class BankDetails {
    String bankName;
    String branchNumber;
    String accountNumber;
    String accountHolderName;
    String swiftCode;

    public boolean isComplete() {
        return present(bankName) && present(branchNumber) && present(accountNumber) && present(accountHolderName);
    }

    /**
     * Account number with all but the last four digits hidden, for logs.
     */
    public String maskedAccount() {
        if (accountNumber == null || accountNumber.length() <= 4) {
            return "****";
        }
        return "****" + accountNumber.substring(accountNumber.length() - 4);
    }

    private static boolean present(String value) {
        return value != null && !value.isBlank();
    }
}
