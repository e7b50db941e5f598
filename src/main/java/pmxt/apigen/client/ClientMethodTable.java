package pmxt.apigen.client;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Hand-maintained client configuration: which members stay hand-written (the skip-list),
 * how every other member is unpacked, and which type names the client package declares.
 */
public final class ClientMethodTable {

    public static final Set<String> DEFAULT_SKIPPED = Set.of(
            "fetchOHLCV",
            "fetchTrades",
            "watchOrderBook",
            "watchTrades",
            "createOrder",
            "getExecutionPrice",
            "getExecutionPriceDetailed",
            "filterMarkets",
            "filterEvents");

    public static final Set<String> DEFAULT_SDK_TYPES = Set.of(
            "UnifiedMarket", "UnifiedEvent", "MarketOutcome", "Order", "Trade", "UserTrade",
            "Position", "Balance", "PriceCandle", "OrderBook", "OrderLevel",
            "ExecutionPriceResult", "PaginatedResult",
            "MarketFetchParams", "MarketFilterParams", "EventFetchParams", "OHLCVParams",
            "HistoryFilterParams", "TradesParams", "CreateOrderParams", "MyTradesParams",
            "OrderHistoryParams");

    public static final ClientMethodTable DEFAULT = new ClientMethodTable(DEFAULT_SKIPPED, defaultSpecs(), DEFAULT_SDK_TYPES);

    private final Set<String> skipped;
    private final Map<String, ClientMethodSpec> specs;
    private final Set<String> sdkTypes;

    public ClientMethodTable(Set<String> skipped, Map<String, ClientMethodSpec> specs, Set<String> sdkTypes) {
        this.skipped = Set.copyOf(Objects.requireNonNull(skipped, "skipped"));
        this.specs = Map.copyOf(Objects.requireNonNull(specs, "specs"));
        this.sdkTypes = Set.copyOf(Objects.requireNonNull(sdkTypes, "sdkTypes"));
        for (String name : this.specs.keySet()) {
            if (this.skipped.contains(name)) {
                throw new IllegalArgumentException("member both skipped and mapped: " + name);
            }
        }
    }

    public boolean isSkipped(String member) {
        return skipped.contains(member);
    }

    public Optional<ClientMethodSpec> specFor(String member) {
        return Optional.ofNullable(specs.get(member));
    }

    public Set<String> skipped() {
        return skipped;
    }

    public Set<String> sdkTypes() {
        return sdkTypes;
    }

    private static Map<String, ClientMethodSpec> defaultSpecs() {
        final Map<String, ClientMethodSpec> m = new LinkedHashMap<>();
        m.put("loadMarkets", ClientMethodSpec.of("Map<String, UnifiedMarket>", ResponsePattern.RECORD, "convertMarket"));
        m.put("fetchMarkets", ClientMethodSpec.of("List<UnifiedMarket>", ResponsePattern.ARRAY, "convertMarket"));
        m.put("fetchMarketsPaginated", ClientMethodSpec.of("PaginatedResult<UnifiedMarket>", ResponsePattern.PAGINATED, "convertMarket"));
        m.put("fetchEvents", ClientMethodSpec.of("List<UnifiedEvent>", ResponsePattern.ARRAY, "convertEvent"));
        m.put("fetchMarket", ClientMethodSpec.of("UnifiedMarket", ResponsePattern.SINGLE, "convertMarket"));
        m.put("fetchEvent", ClientMethodSpec.of("UnifiedEvent", ResponsePattern.SINGLE, "convertEvent"));
        m.put("fetchOrderBook", ClientMethodSpec.of("OrderBook", ResponsePattern.SINGLE, "convertOrderBook"));
        m.put("cancelOrder", ClientMethodSpec.of("Order", ResponsePattern.SINGLE, "convertOrder"));
        m.put("fetchOrder", ClientMethodSpec.of("Order", ResponsePattern.SINGLE, "convertOrder"));
        m.put("fetchOpenOrders", ClientMethodSpec.of("List<Order>", ResponsePattern.ARRAY, "convertOrder"));
        m.put("fetchMyTrades", ClientMethodSpec.of("List<UserTrade>", ResponsePattern.ARRAY, "convertUserTrade"));
        m.put("fetchClosedOrders", ClientMethodSpec.of("List<Order>", ResponsePattern.ARRAY, "convertOrder"));
        m.put("fetchAllOrders", ClientMethodSpec.of("List<Order>", ResponsePattern.ARRAY, "convertOrder"));
        m.put("fetchPositions", ClientMethodSpec.of("List<Position>", ResponsePattern.ARRAY, "convertPosition"));
        m.put("fetchBalance", ClientMethodSpec.of("List<Balance>", ResponsePattern.ARRAY, "convertBalance"));
        m.put("close", ClientMethodSpec.voidMethod());
        return m;
    }
}
