package com.temboplus.payment.gateway.enums;

/**
 * The two wallets exposed by the gateway, each with its own balance and statement operation.
 */
public enum WalletAccount {
  COLLECTION(ApiOperation.COLLECTION_BALANCE, ApiOperation.COLLECTION_STATEMENT),
  MAIN(ApiOperation.MAIN_BALANCE, ApiOperation.MAIN_STATEMENT);

  private final ApiOperation balanceOperation;
  private final ApiOperation statementOperation;

  WalletAccount(ApiOperation balanceOperation, ApiOperation statementOperation) {
    this.balanceOperation = balanceOperation;
    this.statementOperation = statementOperation;
  }

  public ApiOperation getBalanceOperation() {
    return balanceOperation;
  }

  public ApiOperation getStatementOperation() {
    return statementOperation;
  }
}
