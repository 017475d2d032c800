package com.signalsentinel.core.dispatch;

import com.signalsentinel.core.channel.AlertChannel;
import com.signalsentinel.core.channel.ChannelResult;
import com.signalsentinel.core.config.DispatchConfig;
import com.signalsentinel.core.model.AlertType;
import com.signalsentinel.core.model.CandidateAlert;
import com.signalsentinel.core.state.DispatchState;
import com.signalsentinel.core.state.DispatchStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Delivers at most one candidate alert per cycle.
 *
 * <h3>Algorithm</h3>
 * <ol>
 * <li>Order candidates by priority: market state, whale activity, news.</li>
 * <li>For each candidate, resolve its {@link AlertContext}; without one the
 * candidate is reported and skipped.</li>
 * <li>Reject when the channel throttle is active, globally or for the
 * type.</li>
 * <li>Reject news whose id has already been delivered.</li>
 * <li>Format and send. A failed send leaves {@link DispatchState} untouched
 * so the alert stays eligible later.</li>
 * <li>On success record the delivery and stop: one message per cycle.</li>
 * </ol>
 *
 * <p>
 * Only a successful send consumes the cycle's budget; rejections and
 * failures fall through to the next candidate. Throttling uses the alert's
 * cycle timestamp as "now".
 * </p>
 *
 * @since 1.0.0
 */
public class AlertDispatcher {

    private static final Logger LOG = LoggerFactory.getLogger(AlertDispatcher.class);

    static final String REASON_MISSING_CONTEXT = "Missing context for alert";
    static final String REASON_RATE_LIMITED = "Rate limited (cooldown active)";
    static final String REASON_NEWS_DELIVERED = "News already dispatched: ";
    static final String REASON_SEND_FAILED = "Channel send failed: ";

    private static final Comparator<CandidateAlert> PRIORITY =
            Comparator.comparingInt(alert -> alert.getType().dispatchPriority());

    private final Duration cooldown;
    private final AlertChannel channel;
    private final AlertMessageFormatter formatter;

    public AlertDispatcher(DispatchConfig config, AlertChannel channel) {
        this(config, channel, new AlertMessageFormatter());
    }

    /**
     * @param config    dispatch configuration
     * @param channel   delivery channel
     * @param formatter message renderer
     * @throws IllegalStateException if the configuration is invalid
     */
    public AlertDispatcher(DispatchConfig config, AlertChannel channel, AlertMessageFormatter formatter) {
        Objects.requireNonNull(config, "DispatchConfig must not be null").validate();
        this.cooldown = config.cooldown();
        this.channel = Objects.requireNonNull(channel, "channel must not be null");
        this.formatter = Objects.requireNonNull(formatter, "formatter must not be null");
    }

    /**
     * Dispatch one cycle's candidates.
     *
     * @param candidates candidates from the engine, any order
     * @param contexts   formatting contexts built by the caller
     * @param store      dispatch state owner
     * @return one result per attempted candidate, in attempt order
     */
    public List<DispatchResult> dispatch(List<CandidateAlert> candidates,
            AlertContexts contexts,
            DispatchStateStore store) {
        Objects.requireNonNull(candidates, "candidates must not be null");
        Objects.requireNonNull(contexts, "contexts must not be null");
        Objects.requireNonNull(store, "store must not be null");

        List<CandidateAlert> ordered = new ArrayList<>(candidates);
        ordered.sort(PRIORITY);

        List<DispatchResult> results = new ArrayList<>();
        for (CandidateAlert alert : ordered) {
            DispatchResult result = attempt(alert, contexts, store);
            results.add(result);
            if (result.isDispatched()) {
                break;
            }
        }
        return Collections.unmodifiableList(results);
    }

    private DispatchResult attempt(CandidateAlert alert, AlertContexts contexts, DispatchStateStore store) {
        Optional<AlertContext> context = contexts.find(alert);
        if (context.isEmpty()) {
            LOG.info("Skipping {}: {}", alert.getType(), REASON_MISSING_CONTEXT);
            return DispatchResult.rejected(alert, REASON_MISSING_CONTEXT);
        }
        if (context.get().getAlertType() != alert.getType()) {
            LOG.warn("Skipping {}: context is for {}", alert.getType(), context.get().getAlertType());
            return DispatchResult.rejected(alert, REASON_MISSING_CONTEXT);
        }

        DispatchState state = store.get();
        Instant now = alert.getCreatedAt();

        if (!state.canSend(alert.getType(), now, cooldown)) {
            LOG.debug("Throttled {} at {}", alert.getType(), now);
            return DispatchResult.rejected(alert, REASON_RATE_LIMITED);
        }

        String newsId = null;
        if (alert.getType() == AlertType.HIGH_IMPACT_NEWS_ALERT) {
            // context was looked up by subject id and type-checked above
            newsId = ((NewsContext) context.get()).getNewsId();
            if (state.isNewsDelivered(newsId)) {
                LOG.debug("News [{}] already delivered", newsId);
                return DispatchResult.rejected(alert, REASON_NEWS_DELIVERED + newsId);
            }
        }

        String text = formatter.format(alert, context.get());
        ChannelResult sent = send(text);
        if (!sent.isSuccess()) {
            LOG.warn("Delivery of {} via {} failed: {}", alert.getType(), channel.name(), sent.getErrorReason());
            return DispatchResult.failed(alert, REASON_SEND_FAILED + sent.getErrorReason(), sent);
        }

        store.set(state.recordDelivery(alert.getType(), now, newsId));
        LOG.info("Dispatched {} via {} (messageId={})", alert.getType(), channel.name(), sent.getMessageId());
        return DispatchResult.dispatched(alert, sent);
    }

    private ChannelResult send(String text) {
        try {
            ChannelResult result = channel.send(text);
            return result != null ? result : ChannelResult.failed("Channel returned no result");
        } catch (RuntimeException e) {
            LOG.error("Channel [{}] threw while sending", channel.name(), e);
            return ChannelResult.failed(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }
}
