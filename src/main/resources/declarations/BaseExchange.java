package pmxt.exchange;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Predicate;

import com.fasterxml.jackson.annotation.JsonProperty;

import pmxt.exchange.annotations.Default;
import pmxt.exchange.annotations.Nullable;
import pmxt.model.Balance;
import pmxt.model.CreateOrderParams;
import pmxt.model.EventFetchParams;
import pmxt.model.ExecutionPriceResult;
import pmxt.model.HistoryFilterParams;
import pmxt.model.MarketFetchParams;
import pmxt.model.MyTradesParams;
import pmxt.model.OHLCVParams;
import pmxt.model.Order;
import pmxt.model.OrderBook;
import pmxt.model.OrderHistoryParams;
import pmxt.model.PaginatedResult;
import pmxt.model.Position;
import pmxt.model.PriceCandle;
import pmxt.model.Trade;
import pmxt.model.TradesParams;
import pmxt.model.UnifiedEvent;
import pmxt.model.UnifiedMarket;
import pmxt.model.UserTrade;

/**
 * Canonical exchange surface. Every public, non-abstract method here becomes one sidecar
 * operation and, unless skipped, one generated client method.
 * <p>
 * Add a public method here and regenerate; nothing else needs to change.
 */
public abstract class BaseExchange {

    /**
     * Exchange identifier, e.g. {@code polymarket}.
     */
    public abstract String name();

    /**
     * Load and cache all markets from the exchange into the local market and slug maps.
     * Subsequent calls return the cached result without hitting the API again.
     *
     * This is the correct way to paginate or iterate over markets without drift.
     *
     * @param reload force a fresh fetch from the API even if markets are already loaded
     * @return dictionary of markets indexed by marketId
     */
    public CompletableFuture<Map<String, UnifiedMarket>> loadMarkets(@Default("false") boolean reload) {
        throw new UnsupportedOperationException();
    }

    /**
     * Fetch markets with optional filtering, search, or slug lookup.
     * Always hits the exchange API; results reflect the live state at the time of the call.
     *
     * @param params optional parameters for filtering and search
     * @return array of unified markets
     */
    public CompletableFuture<List<UnifiedMarket>> fetchMarkets(@Nullable MarketFetchParams params) {
        throw new UnsupportedOperationException();
    }

    /**
     * Fetch markets with stable cursor-based pagination.
     * Use this when you need consistency across pages even if market ordering drifts.
     */
    public CompletableFuture<PaginatedResult<UnifiedMarket>> fetchMarketsPaginated(@Nullable MarketFetchParams params) {
        throw new UnsupportedOperationException();
    }

    /**
     * Fetch events with optional keyword search.
     * Events group related markets together (e.g., "Who will be Fed Chair?" contains multiple candidate markets).
     *
     * @param params optional parameters for search and filtering
     * @return array of unified events
     */
    public CompletableFuture<List<UnifiedEvent>> fetchEvents(@Nullable EventFetchParams params) {
        throw new UnsupportedOperationException();
    }

    /**
     * Fetch a single market by lookup parameters.
     * Convenience wrapper around fetchMarkets() that returns a single result or throws MarketNotFound.
     *
     * @param params lookup parameters (marketId, outcomeId, slug, etc.)
     * @return a single unified market
     */
    public CompletableFuture<UnifiedMarket> fetchMarket(@Nullable MarketFetchParams params) {
        throw new UnsupportedOperationException();
    }

    /**
     * Fetch a single event by lookup parameters.
     * Convenience wrapper around fetchEvents() that returns a single result or throws EventNotFound.
     *
     * @param params lookup parameters (eventId, slug, query)
     * @return a single unified event
     */
    public CompletableFuture<UnifiedEvent> fetchEvent(@Nullable EventFetchParams params) {
        throw new UnsupportedOperationException();
    }

    /**
     * Implementation for fetching/searching markets.
     */
    protected CompletableFuture<List<UnifiedMarket>> fetchMarketsImpl(@Nullable MarketFetchParams params) {
        throw new UnsupportedOperationException();
    }

    /**
     * Implementation for searching events by keyword.
     */
    protected CompletableFuture<List<UnifiedEvent>> fetchEventsImpl(EventFetchParams params) {
        throw new UnsupportedOperationException();
    }

    /**
     * Fetch historical OHLCV (candlestick) price data for a specific market outcome.
     *
     * @param id the outcome id (outcomeId), not the market id
     * @param params OHLCV parameters including resolution
     * @return array of price candles
     */
    public CompletableFuture<List<PriceCandle>> fetchOHLCV(String id, CandleQuery params) {
        throw new UnsupportedOperationException();
    }

    /**
     * Fetch the current order book (bids/asks) for a specific outcome.
     * Essential for calculating spread, depth, and execution prices.
     *
     * @param id the outcome id (outcomeId)
     * @return current order book with bids and asks
     */
    public CompletableFuture<OrderBook> fetchOrderBook(String id) {
        throw new UnsupportedOperationException();
    }

    /**
     * Fetch raw trade history for a specific outcome.
     *
     * @param id the outcome id (outcomeId)
     * @param params trade filter parameters
     * @return array of recent trades
     */
    public CompletableFuture<List<Trade>> fetchTrades(String id, TradeQuery params) {
        throw new UnsupportedOperationException();
    }

    /**
     * Place a new order on the exchange.
     *
     * @param params order parameters
     * @return the created order
     */
    public CompletableFuture<Order> createOrder(CreateOrderParams params) {
        throw new UnsupportedOperationException();
    }

    /**
     * Cancel an existing open order.
     *
     * @param orderId the order id to cancel
     * @return the cancelled order
     */
    public CompletableFuture<Order> cancelOrder(String orderId) {
        throw new UnsupportedOperationException();
    }

    /**
     * Fetch a specific order by ID.
     *
     * @param orderId the order id to look up
     * @return the order details
     */
    public CompletableFuture<Order> fetchOrder(String orderId) {
        throw new UnsupportedOperationException();
    }

    /**
     * Fetch all open orders, optionally filtered by market.
     *
     * @param marketId optional market id to filter by
     * @return array of open orders
     */
    public CompletableFuture<List<Order>> fetchOpenOrders(@Nullable String marketId) {
        throw new UnsupportedOperationException();
    }

    /**
     * Fetch the authenticated user's trade fills.
     *
     * @param params optional outcome, market, time range and cursor filters
     * @return array of user trades
     */
    public CompletableFuture<List<UserTrade>> fetchMyTrades(@Nullable MyTradesParams params) {
        throw new UnsupportedOperationException();
    }

    /**
     * Fetch filled and cancelled orders.
     *
     * @param params optional market, time range and cursor filters
     * @return array of closed orders
     */
    public CompletableFuture<List<Order>> fetchClosedOrders(@Nullable OrderHistoryParams params) {
        throw new UnsupportedOperationException();
    }

    /**
     * Fetch orders in any state, open and closed.
     *
     * @param params optional market, time range and cursor filters
     * @return array of orders
     */
    public CompletableFuture<List<Order>> fetchAllOrders(@Nullable OrderHistoryParams params) {
        throw new UnsupportedOperationException();
    }

    /**
     * Fetch current user positions across all markets.
     *
     * @return array of current positions
     */
    public CompletableFuture<List<Position>> fetchPositions() {
        throw new UnsupportedOperationException();
    }

    /**
     * Fetch account balances.
     *
     * @return array of account balances
     */
    public CompletableFuture<List<Balance>> fetchBalance() {
        throw new UnsupportedOperationException();
    }

    /**
     * Calculate the volume-weighted average execution price for a given order size.
     * Returns 0 if the order cannot be fully filled.
     *
     * @param orderBook the current order book
     * @param side buy or sell
     * @param amount number of contracts to simulate
     * @return average execution price, or 0 if insufficient liquidity
     */
    public double getExecutionPrice(OrderBook orderBook, Side side, double amount) {
        return getExecutionPriceDetailed(orderBook, side, amount).price();
    }

    /**
     * Calculate detailed execution price information including partial fill data.
     *
     * @param orderBook the current order book
     * @param side buy or sell
     * @param amount number of contracts to simulate
     * @return detailed execution result with price, filled amount, and fill status
     */
    public ExecutionPriceResult getExecutionPriceDetailed(OrderBook orderBook, Side side, double amount) {
        throw new UnsupportedOperationException();
    }

    /**
     * Filter a list of markets by a custom predicate.
     *
     * @param markets markets to filter
     * @param criteria predicate a market has to satisfy
     * @return filtered array of markets
     */
    public List<UnifiedMarket> filterMarkets(List<UnifiedMarket> markets, Predicate<UnifiedMarket> criteria) {
        throw new UnsupportedOperationException();
    }

    /**
     * Filter a list of events by criteria.
     * Can filter by text, category, tags and market count.
     *
     * @param events events to filter
     * @param criteria structured filter criteria
     * @return filtered array of events
     */
    public List<UnifiedEvent> filterEvents(List<UnifiedEvent> events, EventFilterCriteria criteria) {
        throw new UnsupportedOperationException();
    }

    /**
     * Watch order book updates in real-time via WebSocket.
     * Returns a future that completes with the next order book update. Call repeatedly in a loop to stream updates.
     *
     * @param id the outcome id to watch
     * @param limit optional depth limit for the order book
     * @return next order book update
     */
    public CompletableFuture<OrderBook> watchOrderBook(String id, @Nullable Integer limit) {
        throw new UnsupportedOperationException();
    }

    /**
     * Watch trade executions in real-time via WebSocket.
     * Returns a future that completes with the next trade(s). Call repeatedly in a loop to stream updates.
     *
     * @param id the outcome id to watch
     * @param since optional timestamp to filter trades from
     * @param limit optional limit for number of trades
     * @return next trade update(s)
     */
    public CompletableFuture<List<Trade>> watchTrades(String id, @Nullable Long since, @Nullable Integer limit) {
        throw new UnsupportedOperationException();
    }

    /**
     * Close all WebSocket connections and clean up resources.
     * Call this when you're done streaming to properly release connections.
     */
    public CompletableFuture<Void> close() {
        return CompletableFuture.completedFuture(null);
    }

    /**
     * Call an implicit API method by its operationId.
     */
    protected CompletableFuture<Object> callApi(String operationId, @Nullable Map<String, Object> params) {
        throw new UnsupportedOperationException();
    }

    /**
     * Parse an API descriptor and register callable methods on this instance.
     */
    protected void defineImplicitApi(Map<String, Object> descriptor) {
        throw new UnsupportedOperationException();
    }

    /**
     * Introspection: info about all implicit API methods.
     */
    public List<Map<String, Object>> implicitApi() {
        return List.of();
    }

    private String encodeCursor(String snapshotId, int offset) {
        return snapshotId + ":" + offset;
    }

    /**
     * OHLCV parameters, or the deprecated history filter.
     */
    public sealed interface CandleQuery permits OHLCVParams, HistoryFilterParams {
    }

    /**
     * Trade parameters, or the deprecated history filter.
     */
    public sealed interface TradeQuery permits TradesParams, HistoryFilterParams {
    }

    public enum Side {
        @JsonProperty("buy") BUY,
        @JsonProperty("sell") SELL
    }

    public record Range(@Nullable Double min, @Nullable Double max) {
    }

    public record EventFilterCriteria(
            @Nullable String text,
            @Nullable List<String> searchIn,
            @Nullable String category,
            @Nullable List<String> tags,
            @Nullable Range marketCount,
            @Nullable Range totalVolume) {
    }
}
