package tech.oauthplayground.flowengine.model;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * The mutable record of one flow run.
 *
 * <p>Created empty when a run starts and mutated only by the engine's components.
 * The device poller is the only writer that runs on a background thread; it touches
 * {@code pollingStatus} and {@code tokens}, which are volatile.
 *
 * <p>Serialized to the flow state store as JSON. Resource owner credentials are
 * never serialized.
 */
@JsonAutoDetect(
    fieldVisibility = JsonAutoDetect.Visibility.ANY,
    getterVisibility = JsonAutoDetect.Visibility.NONE,
    isGetterVisibility = JsonAutoDetect.Visibility.NONE,
    setterVisibility = JsonAutoDetect.Visibility.NONE)
public class FlowState {

    private String flowId;
    private FlowType flowType;
    private Instant createdAt;

    // Authorization request
    private String authorizationUrl;
    private String state;
    private String nonce;
    private String codeVerifier;
    private String codeChallenge;

    // Callback
    private String authorizationCode;
    private volatile boolean authorizationCodeRedeemed;
    private String callbackError;
    private String callbackErrorDescription;

    // Device authorization
    private String deviceCode;
    private String userCode;
    private String verificationUri;
    private String verificationUriComplete;
    private Instant deviceCodeExpiresAt;
    private Integer deviceInterval;

    private volatile PollingStatus pollingStatus = PollingStatus.idle();

    // ROPC only, held for the duration of the exchange
    @JsonIgnore
    private transient String username;
    @JsonIgnore
    private transient String password;

    private volatile TokenSet tokens;
    private Map<String, Object> introspection;
    private Map<String, Object> userInfo;

    protected FlowState() {
    }

    public FlowState(String flowId, FlowType flowType) {
        this.flowId = flowId;
        this.flowType = flowType;
        this.createdAt = Instant.now();
    }

    public static FlowState start(FlowType flowType) {
        return new FlowState(UUID.randomUUID().toString(), flowType);
    }

    public String getFlowId() {
        return flowId;
    }

    public FlowType getFlowType() {
        return flowType;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public String getAuthorizationUrl() {
        return authorizationUrl;
    }

    public String getState() {
        return state;
    }

    public String getNonce() {
        return nonce;
    }

    /**
     * Record a built authorization request. Replaces any previous correlation values.
     */
    public void applyAuthorizationRequest(AuthorizationRequest request) {
        this.authorizationUrl = request.url();
        this.state = request.state();
        this.nonce = request.nonce();
    }

    public String getCodeVerifier() {
        return codeVerifier;
    }

    public String getCodeChallenge() {
        return codeChallenge;
    }

    public boolean hasPkcePair() {
        return codeVerifier != null && codeChallenge != null;
    }

    /**
     * Set the verifier and challenge together. There is no setter for either alone.
     */
    public void setPkcePair(PkcePair pair) {
        this.codeVerifier = pair.codeVerifier();
        this.codeChallenge = pair.codeChallenge();
    }

    public void clearPkcePair() {
        this.codeVerifier = null;
        this.codeChallenge = null;
    }

    public String getAuthorizationCode() {
        return authorizationCode;
    }

    /**
     * Record a freshly received authorization code. A new code is redeemable again.
     */
    public void setAuthorizationCode(String authorizationCode) {
        this.authorizationCode = authorizationCode;
        this.authorizationCodeRedeemed = false;
    }

    public boolean isAuthorizationCodeRedeemed() {
        return authorizationCodeRedeemed;
    }

    /**
     * Claim the authorization code for redemption.
     *
     * @return true for exactly one caller per received code
     */
    public synchronized boolean markAuthorizationCodeRedeemed() {
        if (authorizationCodeRedeemed) {
            return false;
        }
        authorizationCodeRedeemed = true;
        return true;
    }

    public String getCallbackError() {
        return callbackError;
    }

    public String getCallbackErrorDescription() {
        return callbackErrorDescription;
    }

    public void setCallbackError(String error, String description) {
        this.callbackError = error;
        this.callbackErrorDescription = description;
    }

    public String getDeviceCode() {
        return deviceCode;
    }

    public String getUserCode() {
        return userCode;
    }

    public String getVerificationUri() {
        return verificationUri;
    }

    public String getVerificationUriComplete() {
        return verificationUriComplete;
    }

    public Instant getDeviceCodeExpiresAt() {
        return deviceCodeExpiresAt;
    }

    public Integer getDeviceInterval() {
        return deviceInterval;
    }

    public void applyDeviceAuthorization(DeviceAuthorization authorization) {
        this.deviceCode = authorization.deviceCode();
        this.userCode = authorization.userCode();
        this.verificationUri = authorization.verificationUri();
        this.verificationUriComplete = authorization.verificationUriComplete();
        this.deviceCodeExpiresAt = authorization.expiresAt();
        this.deviceInterval = authorization.interval();
        this.pollingStatus = PollingStatus.idle();
    }

    public boolean isDeviceCodeExpired(Instant now) {
        return deviceCodeExpiresAt != null && !now.isBefore(deviceCodeExpiresAt);
    }

    public PollingStatus getPollingStatus() {
        return pollingStatus;
    }

    public void setPollingStatus(PollingStatus pollingStatus) {
        this.pollingStatus = pollingStatus;
    }

    public String getUsername() {
        return username;
    }

    public String getPassword() {
        return password;
    }

    public void setResourceOwnerCredentials(String username, String password) {
        this.username = username;
        this.password = password;
    }

    public void clearResourceOwnerCredentials() {
        this.username = null;
        this.password = null;
    }

    public TokenSet getTokens() {
        return tokens;
    }

    public boolean hasAccessToken() {
        TokenSet current = tokens;
        return current != null && current.hasAccessToken();
    }

    public void setTokens(TokenSet tokens) {
        this.tokens = tokens;
    }

    public Map<String, Object> getIntrospection() {
        return introspection;
    }

    public void setIntrospection(Map<String, Object> introspection) {
        this.introspection = introspection;
    }

    public Map<String, Object> getUserInfo() {
        return userInfo;
    }

    public void setUserInfo(Map<String, Object> userInfo) {
        this.userInfo = userInfo;
    }
}
