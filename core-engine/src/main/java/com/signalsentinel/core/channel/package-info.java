/**
 * Message delivery channels.
 *
 * <p>
 * {@link com.signalsentinel.core.channel.AlertChannel} is the only outbound
 * dependency of the dispatcher. Built-in implementations:
 * </p>
 * <ul>
 * <li>{@link com.signalsentinel.core.channel.TelegramChannel} — Telegram Bot
 * API</li>
 * <li>{@link com.signalsentinel.core.channel.LoggingChannel} — dry run</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.signalsentinel.core.channel;
