package org.nowstart.squeezewatch.service;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.squeezewatch.data.dto.MarketAnalysisDto;
import org.nowstart.squeezewatch.data.dto.TelegramApiResponse;
import org.nowstart.squeezewatch.data.dto.TelegramUpdate;
import org.nowstart.squeezewatch.data.exception.MarketDataException;
import org.nowstart.squeezewatch.data.property.TelegramProperties;
import org.nowstart.squeezewatch.repository.TelegramFeignClient;
import org.springframework.stereotype.Service;

/**
 * Long-polls {@code getUpdates} on its own thread and answers {@code /start}, {@code /ticker} and
 * {@code /status}. Polling failures back off and resume while the listener is running.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TelegramCommandListener {

    private final TelegramFeignClient telegramFeignClient;
    private final TelegramProperties telegramProperties;
    private final NotificationService notificationService;
    private final MarketAnalysisService marketAnalysisService;
    private final MonitorStatusService monitorStatusService;
    private final AlertMessageFormatter alertMessageFormatter;
    private final Clock clock;

    private final Object lifecycleLock = new Object();
    private Thread pollThread;
    private CountDownLatch stopSignal = new CountDownLatch(0);
    private long offset;

    public boolean start() {
        synchronized (lifecycleLock) {
            if (!telegramProperties.hasToken()) {
                log.info("event=command_listener_disabled reason=telegram_token_missing");
                return false;
            }
            if (pollThread != null && pollThread.isAlive()) {
                return false;
            }
            CountDownLatch signal = new CountDownLatch(1);
            stopSignal = signal;
            pollThread = new Thread(() -> pollLoop(signal), "telegram-command-listener");
            pollThread.setDaemon(true);
            pollThread.start();
            log.info("event=command_listener_started");
            return true;
        }
    }

    public void stop() {
        Thread thread;
        synchronized (lifecycleLock) {
            stopSignal.countDown();
            thread = pollThread;
            pollThread = null;
        }
        if (thread != null) {
            thread.interrupt();
            log.info("event=command_listener_stopped");
        }
    }

    public boolean isRunning() {
        synchronized (lifecycleLock) {
            return pollThread != null && pollThread.isAlive();
        }
    }

    private void pollLoop(CountDownLatch signal) {
        dropPendingUpdates();
        while (signal.getCount() > 0) {
            try {
                pollOnce();
            } catch (Exception e) {
                if (signal.getCount() == 0) {
                    break;
                }
                log.error("event=command_poll_failed backoff={} error={}",
                        telegramProperties.listenerBackoff(), e.getMessage(), e);
                if (await(signal)) {
                    break;
                }
            }
        }
    }

    // Updates queued while the bot was offline are skipped.
    void dropPendingUpdates() {
        try {
            TelegramApiResponse<List<TelegramUpdate>> response =
                    telegramFeignClient.getUpdates(telegramProperties.botToken(), -1L, 0);
            if (response != null && response.ok() && response.result() != null && !response.result().isEmpty()) {
                offset = response.result().get(response.result().size() - 1).update_id() + 1;
            }
        } catch (Exception e) {
            log.warn("event=command_drop_pending_failed error={}", e.getMessage());
        }
    }

    void pollOnce() {
        TelegramApiResponse<List<TelegramUpdate>> response = telegramFeignClient.getUpdates(
                telegramProperties.botToken(),
                offset,
                telegramProperties.pollTimeoutSeconds()
        );
        if (response == null || !response.ok()) {
            throw new IllegalStateException("getUpdates failed: "
                    + (response == null ? "empty response" : response.description()));
        }
        if (response.result() == null) {
            return;
        }

        for (TelegramUpdate update : response.result()) {
            offset = Math.max(offset, update.update_id() + 1);
            handle(update);
        }
    }

    void handle(TelegramUpdate update) {
        TelegramUpdate.Message message = update.message();
        if (message == null || message.chat() == null || message.text() == null) {
            return;
        }

        long chatId = message.chat().id();
        String[] tokens = message.text().trim().split("\\s+");
        String command = tokens[0].toLowerCase(Locale.ROOT);
        int mention = command.indexOf('@');
        if (mention > 0) {
            command = command.substring(0, mention);
        }
        log.info("event=command_received chat_id={} command={}", chatId, command);

        try {
            switch (command) {
                case "/start" -> notificationService.reply(chatId, alertMessageFormatter.help(monitorStatusService.status()));
                case "/status" -> notificationService.reply(chatId,
                        alertMessageFormatter.status(monitorStatusService.status(), clock.instant()));
                case "/ticker" -> handleTicker(chatId, tokens.length > 1 ? tokens[1] : null);
                default -> log.debug("event=command_ignored chat_id={} command={}", chatId, command);
            }
        } catch (Exception e) {
            log.error("event=command_failed chat_id={} command={} error={}", chatId, command, e.getMessage(), e);
            notificationService.reply(chatId, "죄송합니다. 오류가 발생했습니다. 다시 시도해주세요.");
        }
    }

    private void handleTicker(long chatId, String symbol) {
        if (symbol == null || symbol.isBlank()) {
            notificationService.reply(chatId, alertMessageFormatter.tickerUsage());
            return;
        }

        String market = MarketDataService.normalizeMarket(symbol);
        notificationService.reply(chatId, alertMessageFormatter.tickerInProgress(market));
        try {
            MarketAnalysisDto analysis = marketAnalysisService.analyze(market);
            notificationService.reply(chatId, alertMessageFormatter.analysis(analysis));
            log.info("event=ticker_analysis_sent chat_id={} market={}", chatId, market);
        } catch (MarketDataException e) {
            log.warn("event=ticker_analysis_unavailable market={} code={} error={}", market, e.getCode(), e.getMessage());
            notificationService.reply(chatId, alertMessageFormatter.tickerUnavailable(market));
        } catch (RuntimeException e) {
            log.error("event=ticker_analysis_failed market={}", market, e);
            notificationService.reply(chatId, alertMessageFormatter.tickerFailed(e.getMessage()));
        }
    }

    private boolean await(CountDownLatch signal) {
        try {
            return signal.await(telegramProperties.listenerBackoff().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }
}
