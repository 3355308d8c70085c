package org.springaicommunity.github.exporter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Service for GitHub REST API operations.
 *
 * <p>
 * Converts GitHub API JSON responses to strongly-typed records at the service boundary.
 * API failures propagate as {@link GitHubApiException}; a response that is not valid
 * JSON raises an {@link ExportException}.
 */
public class GitHubRestService implements GitHubApiService {

	private static final Logger logger = LoggerFactory.getLogger(GitHubRestService.class);

	private final GitHubClient httpClient;

	private final ObjectMapper objectMapper;

	public GitHubRestService(GitHubClient httpClient, ObjectMapper objectMapper) {
		this.httpClient = httpClient;
		this.objectMapper = objectMapper;
	}

	@Override
	public RateLimitInfo getRateLimit() {
		JsonNode core = read(httpClient.get("/rate_limit")).path("resources").path("core");
		return new RateLimitInfo(core.path("limit").asInt(-1), core.path("remaining").asInt(-1),
				core.path("reset").asLong(-1), core.path("used").asInt(-1));
	}

	@Override
	public RepositoryInfo getRepository(String repoName) {
		String[] parts = RepositoryInfo.splitReference(repoName);
		JsonNode node = read(httpClient.get("/repos/" + parts[0] + "/" + parts[1]));
		return new RepositoryInfo(node.path("id").asLong(), node.path("owner").path("login").asText(parts[0]),
				node.path("name").asText(parts[1]), textOrNull(node.path("description")),
				node.path("html_url").asText(""), node.path("private").asBoolean(false),
				node.path("default_branch").asText("main"));
	}

	@Override
	public List<PullRequest> listPullRequests(String owner, String repo, int page, int perPage) {
		String query = "state=all&sort=updated&direction=desc" + paging(page, perPage);
		JsonNode nodes = read(httpClient.getWithQuery(repoPath(owner, repo) + "/pulls", query));
		List<PullRequest> result = new ArrayList<>();
		for (JsonNode node : nodes) {
			result.add(new PullRequest(node.path("number").asInt(), node.path("title").asText(""),
					textOrNull(node.path("body")), node.path("state").asText(""),
					requiredInstant(node.path("created_at")), requiredInstant(node.path("updated_at")),
					parseInstant(node.path("closed_at")), parseInstant(node.path("merged_at")),
					node.path("html_url").asText(""), parseAuthor(node.path("user")),
					parseLabels(node.path("labels")), node.path("draft").asBoolean(false),
					textOrNull(node.path("head").path("ref")), textOrNull(node.path("base").path("ref"))));
		}
		return result;
	}

	@Override
	public List<Issue> listIssues(String owner, String repo, @Nullable Instant since, int page, int perPage) {
		String query = "state=all&sort=updated&direction=desc" + sinceParam(since) + paging(page, perPage);
		JsonNode nodes = read(httpClient.getWithQuery(repoPath(owner, repo) + "/issues", query));
		List<Issue> result = new ArrayList<>();
		for (JsonNode node : nodes) {
			result.add(new Issue(node.path("number").asInt(), node.path("title").asText(""),
					textOrNull(node.path("body")), node.path("state").asText(""),
					requiredInstant(node.path("created_at")), requiredInstant(node.path("updated_at")),
					parseInstant(node.path("closed_at")), node.path("html_url").asText(""),
					parseAuthor(node.path("user")), parseLabels(node.path("labels")), node.path("comments").asInt(0),
					node.has("pull_request")));
		}
		return result;
	}

	@Override
	public List<Commit> listCommits(String owner, String repo, @Nullable Instant since, int page, int perPage) {
		String query = (sinceParam(since) + paging(page, perPage)).substring(1);
		JsonNode nodes = read(httpClient.getWithQuery(repoPath(owner, repo) + "/commits", query));
		List<Commit> result = new ArrayList<>();
		for (JsonNode node : nodes) {
			JsonNode commit = node.path("commit");
			JsonNode gitAuthor = commit.path("author");
			Author author = node.path("author").isObject()
					? new Author(node.path("author").path("login").asText("unknown"), textOrNull(gitAuthor.path("name")))
					: new Author(gitAuthor.path("email").asText("unknown"), textOrNull(gitAuthor.path("name")));
			result.add(new Commit(node.path("sha").asText(""), commit.path("message").asText(""), author,
					requiredInstant(gitAuthor.path("date")), node.path("html_url").asText("")));
		}
		return result;
	}

	@Override
	public List<Branch> listBranches(String owner, String repo, int page, int perPage) {
		String query = paging(page, perPage).substring(1);
		JsonNode nodes = read(httpClient.getWithQuery(repoPath(owner, repo) + "/branches", query));
		List<Branch> result = new ArrayList<>();
		for (JsonNode node : nodes) {
			result.add(new Branch(node.path("name").asText(""), node.path("commit").path("sha").asText(""),
					node.path("protected").asBoolean(false)));
		}
		return result;
	}

	@Override
	public List<Release> listReleases(String owner, String repo, int page, int perPage) {
		String query = paging(page, perPage).substring(1);
		JsonNode nodes = read(httpClient.getWithQuery(repoPath(owner, repo) + "/releases", query));
		List<Release> result = new ArrayList<>();
		for (JsonNode node : nodes) {
			List<Release.Asset> assets = new ArrayList<>();
			for (JsonNode asset : node.path("assets")) {
				assets.add(new Release.Asset(asset.path("name").asText(""), asset.path("size").asLong(0),
						asset.path("download_count").asInt(0), asset.path("browser_download_url").asText("")));
			}
			result.add(new Release(node.path("id").asLong(), node.path("tag_name").asText(""),
					textOrNull(node.path("name")), textOrNull(node.path("body")), node.path("draft").asBoolean(false),
					node.path("prerelease").asBoolean(false), requiredInstant(node.path("created_at")),
					parseInstant(node.path("published_at")), parseAuthor(node.path("author")),
					node.path("html_url").asText(""), assets));
		}
		return result;
	}

	private JsonNode read(String response) {
		try {
			return objectMapper.readTree(response);
		}
		catch (JsonProcessingException e) {
			logger.error("Malformed JSON response: {}", e.getOriginalMessage());
			throw new ExportException("GitHub returned a malformed JSON response", e);
		}
	}

	private static String repoPath(String owner, String repo) {
		return "/repos/" + owner + "/" + repo;
	}

	private static String paging(int page, int perPage) {
		return "&per_page=" + perPage + "&page=" + page;
	}

	private static String sinceParam(@Nullable Instant since) {
		return (since != null) ? "&since=" + since : "";
	}

	private Author parseAuthor(JsonNode user) {
		if (user == null || user.isMissingNode() || user.isNull()) {
			return Author.UNKNOWN;
		}
		return new Author(user.path("login").asText("unknown"), textOrNull(user.path("name")));
	}

	private List<Label> parseLabels(JsonNode labels) {
		List<Label> result = new ArrayList<>();
		for (JsonNode label : labels) {
			result.add(new Label(label.path("name").asText(""), textOrNull(label.path("color")),
					textOrNull(label.path("description"))));
		}
		return result;
	}

	@Nullable
	private static String textOrNull(JsonNode node) {
		return (node.isMissingNode() || node.isNull()) ? null : node.asText();
	}

	private Instant requiredInstant(JsonNode node) {
		Instant instant = parseInstant(node);
		return (instant != null) ? instant : Instant.EPOCH;
	}

	@Nullable
	private Instant parseInstant(JsonNode node) {
		String text = textOrNull(node);
		if (text == null || text.isEmpty()) {
			return null;
		}
		try {
			return Instant.parse(text);
		}
		catch (DateTimeParseException e) {
			logger.warn("Failed to parse datetime: {}", text);
			return null;
		}
	}

}
