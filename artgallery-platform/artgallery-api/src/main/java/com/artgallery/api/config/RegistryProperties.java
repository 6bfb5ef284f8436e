package com.artgallery.api.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the registry engine and its payment ledger.
 */
@Configuration
@ConfigurationProperties(prefix = "artgallery.registry")
public class RegistryProperties {

    private String administrator;
    private int platformFeeRate = 25; // 2.5%
    private String journalPath;
    private String escrowAccount = "REGISTRY_ESCROW";

    public String getAdministrator() { return administrator; }
    public void setAdministrator(String administrator) { this.administrator = administrator; }
    public int getPlatformFeeRate() { return platformFeeRate; }
    public void setPlatformFeeRate(int platformFeeRate) { this.platformFeeRate = platformFeeRate; }
    public String getJournalPath() { return journalPath; }
    public void setJournalPath(String journalPath) { this.journalPath = journalPath; }
    public String getEscrowAccount() { return escrowAccount; }
    public void setEscrowAccount(String escrowAccount) { this.escrowAccount = escrowAccount; }
}
