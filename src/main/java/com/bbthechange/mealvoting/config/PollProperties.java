package com.bbthechange.mealvoting.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.temporal.ChronoUnit;

@Component
@ConfigurationProperties(prefix = "poll")
public class PollProperties {

    private final Chain chain = new Chain();
    private final RuntimeSettings runtime = new RuntimeSettings();

    public Chain getChain() {
        return chain;
    }

    public RuntimeSettings getRuntime() {
        return runtime;
    }

    public static class Chain {

        // Tokens granted to every chain opened by CreatePoll
        private BigDecimal initialBalance = BigDecimal.TEN;

        private String rootOwner = "root";

        public BigDecimal getInitialBalance() {
            return initialBalance;
        }

        public void setInitialBalance(BigDecimal initialBalance) {
            this.initialBalance = initialBalance;
        }

        public String getRootOwner() {
            return rootOwner;
        }

        public void setRootOwner(String rootOwner) {
            this.rootOwner = rootOwner;
        }
    }

    public static class RuntimeSettings {

        @DurationUnit(ChronoUnit.SECONDS)
        private Duration callTimeout = Duration.ofSeconds(10);

        private int workerThreads = 4;

        public Duration getCallTimeout() {
            return callTimeout;
        }

        public void setCallTimeout(Duration callTimeout) {
            this.callTimeout = callTimeout;
        }

        public int getWorkerThreads() {
            return workerThreads;
        }

        public void setWorkerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
        }
    }
}
