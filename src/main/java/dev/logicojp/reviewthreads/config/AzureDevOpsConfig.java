package dev.logicojp.reviewthreads.config;

import io.micronaut.context.annotation.ConfigurationProperties;
import io.micronaut.core.annotation.Nullable;

import java.net.URI;
import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Connection settings for the Azure DevOps pull request thread API.
 *
 * <p>{@code organization} may be a bare organization name ({@code contoso}) or a
 * full URL ({@code https://dev.azure.com/contoso}). The token is a personal
 * access token and is never included in {@link #toString()}.</p>
 */
@ConfigurationProperties("reviewer.devops")
public record AzureDevOpsConfig(
    String organization,
    String project,
    String repository,
    @Nullable String apiVersion,
    @Nullable String token
) {

    public static final String DEFAULT_API_VERSION = "7.0";
    private static final String DEFAULT_HOST = "https://dev.azure.com/";

    public AzureDevOpsConfig {
        organization = normalizeOrganization(requireText(organization, "organization"));
        project = requireText(project, "project");
        repository = requireText(repository, "repository");
        apiVersion = ConfigDefaults.defaultIfBlank(apiVersion, DEFAULT_API_VERSION);
        token = (token == null || token.isBlank()) ? null : token;
    }

    public AzureDevOpsConfig(String organization, String project, String repository) {
        this(organization, project, repository, DEFAULT_API_VERSION, null);
    }

    private static String requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Azure DevOps " + name + " must be configured");
        }
        return value.trim();
    }

    private static String normalizeOrganization(String organization) {
        String trimmed = organization;
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        if (trimmed.startsWith("http://") || trimmed.startsWith("https://")) {
            URI parsed = URI.create(trimmed);
            if (parsed.getHost() == null || parsed.getHost().isBlank()) {
                throw new IllegalArgumentException("Azure DevOps organization URL must include host: " + organization);
            }
            return trimmed;
        }
        return DEFAULT_HOST + trimmed.replaceFirst("^/+", "");
    }

    public boolean hasToken() {
        return token != null;
    }

    /**
     * Builds a REST API URL below the repository resource.
     * @param repoId repository id (GUID)
     * @param pathSegments segments appended after {@code repositories/<repoId>}
     * @return URL including the {@code api-version} query parameter
     */
    public String buildApiUrl(String repoId, Object... pathSegments) {
        String path = Arrays.stream(pathSegments)
            .map(String::valueOf)
            .collect(Collectors.joining("/"));
        return "%s/%s/_apis/git/repositories/%s/%s?api-version=%s"
            .formatted(organization, project, repoId, path, apiVersion);
    }

    /**
     * Web URL of a pull request. Discussion links are built on top of it.
     * @param prId pull request id
     * @return e.g. {@code https://dev.azure.com/org/project/_git/repo/pullRequest/42}
     */
    public String pullRequestUrl(long prId) {
        return "%s/%s/_git/%s/pullRequest/%d".formatted(organization, project, repository, prId);
    }

    @Override
    public String toString() {
        return "AzureDevOpsConfig{organization='%s', project='%s', repository='%s', apiVersion='%s', token=%s}"
            .formatted(organization, project, repository, apiVersion, hasToken() ? "***" : "<none>");
    }
}
