package com.example.shortvideo_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "pexels")
public class PexelsProperties {

    private String baseUrl = "https://api.pexels.com";
    private String apiKey = "";
    private int perPage = 80;
    private long searchTimeoutSeconds = 10;
    private int searchAttempts = 3;
    /** Extra seconds a clip must last beyond the narration. */
    private double durationBufferSeconds = 3.0;
    /** Generic terms tried when none of the scene's terms returns a usable clip. */
    private List<String> jokerTerms = new ArrayList<>(List.of("nature", "globe", "space", "ocean"));

    public String getBaseUrl() { return baseUrl; }
    public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

    public String getApiKey() { return apiKey; }
    public void setApiKey(String apiKey) { this.apiKey = apiKey; }

    public int getPerPage() { return perPage; }
    public void setPerPage(int perPage) { this.perPage = perPage; }

    public long getSearchTimeoutSeconds() { return searchTimeoutSeconds; }
    public void setSearchTimeoutSeconds(long searchTimeoutSeconds) { this.searchTimeoutSeconds = searchTimeoutSeconds; }

    public int getSearchAttempts() { return searchAttempts; }
    public void setSearchAttempts(int searchAttempts) { this.searchAttempts = searchAttempts; }

    public double getDurationBufferSeconds() { return durationBufferSeconds; }
    public void setDurationBufferSeconds(double durationBufferSeconds) { this.durationBufferSeconds = durationBufferSeconds; }

    public List<String> getJokerTerms() { return jokerTerms; }
    public void setJokerTerms(List<String> jokerTerms) { this.jokerTerms = jokerTerms; }
}
