package com.signalsentinel.flink;

import com.signalsentinel.core.dispatch.AlertContexts;
import com.signalsentinel.core.dispatch.MarketContext;
import com.signalsentinel.core.dispatch.NewsContext;
import com.signalsentinel.core.dispatch.WhaleContext;
import com.signalsentinel.core.model.MarketSnapshot;
import com.signalsentinel.core.model.NewsItem;

import java.util.Objects;

/**
 * Builds the formatting contexts for one snapshot: one market and one whale
 * context when those sections are present, and one context per news item
 * that carries an id.
 */
final class SnapshotContexts {

    private SnapshotContexts() {
        // utility class
    }

    static AlertContexts of(MarketSnapshot snapshot, String asset) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        Objects.requireNonNull(asset, "asset must not be null");

        AlertContexts.Builder contexts = AlertContexts.builder();
        snapshot.getMarket().ifPresent(market -> contexts.market(
                new MarketContext(asset, market.getScore(), market.getBias(), market.getConfidence())));
        snapshot.getWhale().ifPresent(whale -> contexts.whale(new WhaleContext(asset, whale.getNetFlow())));

        for (NewsItem item : snapshot.getNews()) {
            if (item == null || item.getId() == null || item.getId().isBlank()) {
                continue;
            }
            contexts.news(new NewsContext(asset, item.getId(), item.getTitle(), item.getBias(), item.getCategory()));
        }
        return contexts.build();
    }
}
