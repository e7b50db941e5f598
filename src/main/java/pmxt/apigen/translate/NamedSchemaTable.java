package pmxt.apigen.translate;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Maps well-known domain type names to component schema ids.
 * Immutable; {@link #DEFAULT} is the exchange table shared by the whole process.
 */
public final class NamedSchemaTable {

    public static final String COMPONENT_PREFIX = "#/components/schemas/";

    public static final NamedSchemaTable DEFAULT = new NamedSchemaTable(defaultEntries());

    private final Map<String, String> schemaIdsByTypeName;

    public NamedSchemaTable(Map<String, String> schemaIdsByTypeName) {
        Objects.requireNonNull(schemaIdsByTypeName, "schemaIdsByTypeName");
        this.schemaIdsByTypeName = Map.copyOf(schemaIdsByTypeName);
    }

    public Optional<String> schemaIdFor(String typeName) {
        return Optional.ofNullable(schemaIdsByTypeName.get(typeName));
    }

    public String refFor(String schemaId) {
        return COMPONENT_PREFIX + schemaId;
    }

    public Collection<String> schemaIds() {
        return new TreeSet<>(schemaIdsByTypeName.values());
    }

    private static Map<String, String> defaultEntries() {
        final Map<String, String> m = new LinkedHashMap<>();
        m.put("UnifiedMarket", "UnifiedMarket");
        m.put("UnifiedEvent", "UnifiedEvent");
        m.put("MarketOutcome", "MarketOutcome");
        m.put("Order", "Order");
        m.put("Trade", "Trade");
        m.put("UserTrade", "UserTrade");
        m.put("Position", "Position");
        m.put("Balance", "Balance");
        m.put("PriceCandle", "PriceCandle");
        m.put("OrderBook", "OrderBook");
        m.put("OrderLevel", "OrderLevel");
        m.put("ExecutionPriceResult", "ExecutionPriceResult");
        m.put("PaginatedMarketsResult", "PaginatedMarketsResult");
        // MarketFetchParams is the fetch-side name of the same filter object
        m.put("MarketFetchParams", "MarketFilterParams");
        m.put("MarketFilterParams", "MarketFilterParams");
        m.put("EventFetchParams", "EventFetchParams");
        m.put("OHLCVParams", "OHLCVParams");
        m.put("HistoryFilterParams", "HistoryFilterParams");
        m.put("TradesParams", "TradesParams");
        m.put("CreateOrderParams", "CreateOrderParams");
        m.put("MyTradesParams", "MyTradesParams");
        m.put("OrderHistoryParams", "OrderHistoryParams");
        return m;
    }
}
