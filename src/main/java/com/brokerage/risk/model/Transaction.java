package com.brokerage.risk.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "A brokerage transaction read from the feed")
public class Transaction {

    @Schema(description = "Store-assigned, strictly increasing transaction id", example = "42017")
    long transactionId;

    @Schema(description = "Execution timestamp in epoch milliseconds", example = "1739886764000")
    long timestamp;

    @Schema(description = "Client identifier", example = "CLIENT_001")
    String clientId;

    @Schema(description = "Traded symbol", example = "AAPL")
    String symbol;

    @Schema(description = "Trade side", example = "BUY")
    TransactionSide side;

    @Schema(description = "Number of shares", example = "100")
    long quantity;

    @Schema(description = "Price per share", example = "182.35")
    double price;

    @Schema(description = "quantity x price", example = "18235.00")
    double totalValue;

    @Schema(description = "Executing broker", example = "BROKER_03")
    String brokerId;

    @Schema(description = "Market / venue", example = "NASDAQ")
    String market;

    public FeedMarker position() {
        return new FeedMarker(timestamp, transactionId);
    }
}
