package in.trendbook.domain.account;

import java.math.BigDecimal;

/**
 * Wallet event.
 */
public record WalletUpdate(String accountType, BigDecimal totalEquity) {
    public WalletUpdate {
        if (totalEquity == null) {
            throw new IllegalArgumentException("totalEquity cannot be null");
        }
    }
}
