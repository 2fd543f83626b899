package io.github.drompincen.taskbridge.client.scoro;

/**
 * @param companyAccount account subdomain; a full {@code https://name.scoro.com/...} URL is accepted and cleaned
 * @param baseUrl        API root, derived from the account when blank
 */
public record ScoroSettings(
        String companyAccount,
        String apiKey,
        String baseUrl,
        String lang
) {
    public ScoroSettings {
        companyAccount = cleanAccount(companyAccount);
        if (baseUrl == null || baseUrl.isBlank()) {
            baseUrl = companyAccount.isEmpty() ? "" : "https://" + companyAccount + ".scoro.com/api/v2/";
        } else if (!baseUrl.endsWith("/")) {
            baseUrl = baseUrl + "/";
        }
        lang = lang == null || lang.isBlank() ? "eng" : lang;
    }

    static String cleanAccount(String raw) {
        if (raw == null) {
            return "";
        }
        String account = raw.trim();
        if (account.startsWith("https://")) {
            account = account.substring("https://".length());
        } else if (account.startsWith("http://")) {
            account = account.substring("http://".length());
        }
        int domain = account.indexOf(".scoro.com");
        if (domain >= 0) {
            account = account.substring(0, domain);
        }
        int slash = account.indexOf('/');
        if (slash >= 0) {
            account = account.substring(0, slash);
        }
        return account;
    }

    public boolean isComplete() {
        return !companyAccount.isEmpty() && apiKey != null && !apiKey.isBlank();
    }
}
