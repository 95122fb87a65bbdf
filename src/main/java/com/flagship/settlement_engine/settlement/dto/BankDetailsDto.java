package com.flagship.settlement_engine.settlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.settlement_engine.settlement.BankDetails;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Bank account on the wire, used both in payout requests and responses.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BankDetailsDto {

    @Size(max = 100)
    @JsonProperty("bank_name")
    private String bankName;

    @Size(max = 20)
    @JsonProperty("branch_number")
    private String branchNumber;

    @Size(max = 40)
    @JsonProperty("account_number")
    private String accountNumber;

    @Size(max = 120)
    @JsonProperty("account_holder_name")
    private String accountHolderName;

    @Size(max = 20)
    @JsonProperty("swift_code")
    private String swiftCode;

    public BankDetails toDomain() {
        return new BankDetails(bankName, branchNumber, accountNumber, accountHolderName, swiftCode);
    }

    public static BankDetailsDto from(BankDetails details) {
        if (details == null) {
            return null;
        }
        return new BankDetailsDto(details.getBankName(), details.getBranchNumber(), details.getAccountNumber(),
            details.getAccountHolderName(), details.getSwiftCode());
    }
}
