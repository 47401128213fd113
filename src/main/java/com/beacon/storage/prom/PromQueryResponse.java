package com.beacon.storage.prom;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Envelope of a Prometheus HTTP API response
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PromQueryResponse {
    
    @JsonProperty("status")
    private String status;
    
    @JsonProperty("data")
    private PromQueryResult data;
    
    @JsonProperty("errorType")
    private String errorType;
    
    @JsonProperty("error")
    private String error;
    
    public boolean isSuccess() {
        return "success".equals(status);
    }
    
    public String getStatus() {
        return status;
    }
    
    public void setStatus(String status) {
        this.status = status;
    }
    
    public PromQueryResult getData() {
        return data;
    }
    
    public void setData(PromQueryResult data) {
        this.data = data;
    }
    
    public String getErrorType() {
        return errorType;
    }
    
    public void setErrorType(String errorType) {
        this.errorType = errorType;
    }
    
    public String getError() {
        return error;
    }
    
    public void setError(String error) {
        this.error = error;
    }
}
