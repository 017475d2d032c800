package com.signalsentinel.core.dispatch;

import com.signalsentinel.core.model.AlertType;

import java.util.Objects;
import java.util.Optional;

/**
 * Context for a {@link AlertType#HIGH_IMPACT_NEWS_ALERT}. One per news item,
 * keyed by the item id.
 *
 * @since 1.0.0
 */
public final class NewsContext implements AlertContext {

    private final String asset;
    private final String newsId;
    private final String title;
    private final String bias;
    private final String category;

    /**
     * @param category optional news category ({@code sentiment}, {@code macro},
     *                 {@code onchain}); selects the caveat pool
     */
    public NewsContext(String asset, String newsId, String title, String bias, String category) {
        this.asset = Objects.requireNonNull(asset, "asset must not be null");
        this.newsId = Objects.requireNonNull(newsId, "newsId must not be null");
        this.title = title != null ? title : "";
        this.bias = bias != null ? bias : "";
        this.category = category;
    }

    @Override
    public AlertType getAlertType() {
        return AlertType.HIGH_IMPACT_NEWS_ALERT;
    }

    @Override
    public String getAsset() {
        return asset;
    }

    public String getNewsId() {
        return newsId;
    }

    public String getTitle() {
        return title;
    }

    public String getBias() {
        return bias;
    }

    public Optional<String> getCategory() {
        return Optional.ofNullable(category);
    }

    @Override
    public String toString() {
        return "NewsContext{asset='" + asset + "', newsId='" + newsId + "', category=" + category + '}';
    }
}
