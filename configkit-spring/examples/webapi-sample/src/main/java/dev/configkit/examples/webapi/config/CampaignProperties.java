package dev.configkit.examples.webapi.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;

@ConfigurationProperties(prefix = "campaign")
public class CampaignProperties {

    private String name = "";
    private LocalDate startDate;
    private LocalDate endDate;
    private BigDecimal minimumPurchaseAmount;
    private BigDecimal maximumDiscountPercentage;
    private Duration emailReminderInterval;
    private Duration cacheDuration;

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public LocalDate getStartDate() {
        return startDate;
    }

    public void setStartDate(LocalDate startDate) {
        this.startDate = startDate;
    }

    public LocalDate getEndDate() {
        return endDate;
    }

    public void setEndDate(LocalDate endDate) {
        this.endDate = endDate;
    }

    public BigDecimal getMinimumPurchaseAmount() {
        return minimumPurchaseAmount;
    }

    public void setMinimumPurchaseAmount(BigDecimal minimumPurchaseAmount) {
        this.minimumPurchaseAmount = minimumPurchaseAmount;
    }

    public BigDecimal getMaximumDiscountPercentage() {
        return maximumDiscountPercentage;
    }

    public void setMaximumDiscountPercentage(BigDecimal maximumDiscountPercentage) {
        this.maximumDiscountPercentage = maximumDiscountPercentage;
    }

    public Duration getEmailReminderInterval() {
        return emailReminderInterval;
    }

    public void setEmailReminderInterval(Duration emailReminderInterval) {
        this.emailReminderInterval = emailReminderInterval;
    }

    public Duration getCacheDuration() {
        return cacheDuration;
    }

    public void setCacheDuration(Duration cacheDuration) {
        this.cacheDuration = cacheDuration;
    }
}
