package com.questrail.bridge.model;

/**
 * BridgeMethod
 * -----------------------------------------------------------------------------
 * The request methods understood by the bridge service, with their wire names.
 *
 * <p>Each constant corresponds to exactly one typed operation on
 * {@link com.questrail.bridge.api.ProviderBridge}. The wire name is the value
 * carried in the {@code method} field of a request line.</p>
 */
public enum BridgeMethod
{
    LAUNCH("launch"),
    SEND_MESSAGE("sendMessage"),
    STOP("stop"),
    LIST_PROVIDERS("listProviders"),
    CHECK_AUTH("checkAuth"),
    LIST_PROFILES("listProfiles"),
    CREATE_PROFILE("createProfile"),
    SWITCH_PROFILE("switchProfile"),
    DELETE_PROFILE("deleteProfile"),
    GET_CURRENT_PROFILE("getCurrentProfile"),
    LOGIN_WITH_API_KEY("loginWithApiKey"),
    GET_AUTH_OPTIONS("getAuthOptions"),
    LINK_EXISTING_CREDENTIAL("linkExistingCredential");

    private final String wireName;

    BridgeMethod(String wireName)
    {
        this.wireName = wireName;
    }

    public String wireName()
    {
        return wireName;
    }

    @Override
    public String toString()
    {
        return wireName;
    }
}
