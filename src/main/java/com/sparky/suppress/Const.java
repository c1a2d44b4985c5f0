package com.sparky.suppress;

public class Const {
    public static final String ConfigPathProp = "suppression.config";
    public static final String DefaultConfigPath = "sparkpost.ini";

    public static class Config {
        public static final String AuthorizationProp = "Authorization";
        public static final String HostProp = "Host";
        public static final String TimezoneProp = "Timezone";
        public static final String PropertiesProp = "Properties";
        public static final String BatchSizeProp = "BatchSize";
        public static final String TypeDefaultProp = "TypeDefault";
        public static final String DescriptionDefaultProp = "DescriptionDefault";
        public static final String FileCharacterEncodingsProp = "FileCharacterEncodings";
        public static final String DeleteThreadsProp = "DeleteThreads";
        public static final String SubAccountProp = "SubAccount";
        public static final String RequestTimeoutSecondsProp = "RequestTimeoutSeconds";
        public static final String ListBackoffSecondsProp = "ListBackoffSeconds";
        public static final String UpdateBackoffSecondsProp = "UpdateBackoffSeconds";
        public static final String DeleteBackoffSecondsProp = "DeleteBackoffSeconds";
    }

    public static class Defaults {
        public static final String Host = "api.sparkpost.com";
        public static final String Timezone = "UTC";
        public static final String Properties = "recipient,type,description";
        public static final int BatchSize = 10000;
        public static final String TypeDefault = "non_transactional";
        public static final String FileCharacterEncodings = "utf-8";
        public static final int DeleteThreads = 10;
        public static final int RequestTimeoutSeconds = 60;
        public static final int ListBackoffSeconds = 120;
        public static final int UpdateBackoffSeconds = 10;
        public static final int DeleteBackoffSeconds = 10;
    }

    public static class Api {
        public static final String SuppressionListPath = "/api/v1/suppression-list";
        public static final String SubAccountHeader = "X-MSYS-SUBACCOUNT";
        public static final String InitialCursor = "initial";
        public static final String RateLimitMessage = "Too many requests";
    }

    public static class Field {
        public static final String Recipient = "recipient";
        public static final String Type = "type";
        public static final String Source = "source";
        public static final String Description = "description";
        public static final String Created = "created";
        public static final String Updated = "updated";
        public static final String SubaccountId = "subaccount_id";
        public static final String Transactional = "transactional";
        public static final String NonTransactional = "non_transactional";
    }
}
