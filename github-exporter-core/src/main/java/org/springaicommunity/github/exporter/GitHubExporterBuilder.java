package org.springaicommunity.github.exporter;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.time.Clock;

/**
 * Builder assembling a {@link GitHubExporter} and its per-run service graph.
 *
 * <p>
 * Example usage:
 *
 * <pre>
 * {@code
 * // Token and optional API URL from .env or the environment
 * GitHubExporter exporter = GitHubExporterBuilder.create()
 *     .tokenFromEnv()
 *     .build();
 *
 * // With custom configuration
 * ExportProperties props = new ExportProperties();
 * props.setMaxPullRequests(500);
 * props.setMemoryCacheEvictionPolicy("LFU");
 *
 * GitHubExporter exporter = GitHubExporterBuilder.create()
 *     .token("ghp_xxxxx")
 *     .properties(props)
 *     .build();
 *
 * // For testing with a fake HTTP client
 * GitHubExporter testExporter = GitHubExporterBuilder.create()
 *     .httpClient(fakeClient)
 *     .sleeper(duration -> { })
 *     .build();
 * }
 * </pre>
 */
public class GitHubExporterBuilder {

	@Nullable
	private String token;

	private String apiUrl = GitHubHttpClient.DEFAULT_API_BASE;

	private ExportProperties properties;

	@Nullable
	private ObjectMapper objectMapper;

	@Nullable
	private GitHubClient httpClient;

	@Nullable
	private StateManager stateManager;

	@Nullable
	private ExporterFactory exporterFactory;

	private BatchProgressListener progressListener = BatchProgressListener.NONE;

	private Clock clock = Clock.systemUTC();

	private Sleeper sleeper = Sleeper.SYSTEM;

	private GitHubExporterBuilder() {
		this.properties = new ExportProperties();
	}

	/**
	 * Create a new builder instance.
	 * @return new GitHubExporterBuilder
	 */
	public static GitHubExporterBuilder create() {
		return new GitHubExporterBuilder();
	}

	/**
	 * Set the GitHub token directly.
	 * @param token GitHub personal access token
	 * @return this builder
	 */
	public GitHubExporterBuilder token(String token) {
		this.token = token;
		return this;
	}

	/**
	 * Read the GitHub token from {@code GITHUB_TOKEN} and the optional API URL from
	 * {@code GITHUB_API_URL}, looked up through {@link EnvironmentSupport}.
	 * @return this builder
	 * @throws IllegalStateException if GITHUB_TOKEN is not set
	 */
	public GitHubExporterBuilder tokenFromEnv() {
		this.token = EnvironmentSupport.get(EnvironmentSupport.GITHUB_TOKEN);
		if (this.token == null || this.token.trim().isEmpty()) {
			throw new IllegalStateException(
					"GITHUB_TOKEN environment variable is required. Please set your GitHub personal access token.");
		}
		this.apiUrl = EnvironmentSupport.getOrDefault(EnvironmentSupport.GITHUB_API_URL,
				GitHubHttpClient.DEFAULT_API_BASE);
		return this;
	}

	/**
	 * Set the REST API base URL (GitHub Enterprise).
	 * @param apiUrl base URL such as {@code https://github.example.com/api/v3}
	 * @return this builder
	 */
	public GitHubExporterBuilder apiUrl(String apiUrl) {
		this.apiUrl = apiUrl;
		return this;
	}

	/**
	 * Set export properties.
	 * @param properties configuration properties (null to use defaults)
	 * @return this builder
	 */
	public GitHubExporterBuilder properties(@Nullable ExportProperties properties) {
		if (properties != null) {
			this.properties = properties;
		}
		return this;
	}

	/**
	 * Set a custom ObjectMapper.
	 * @param objectMapper Jackson ObjectMapper (null to use default)
	 * @return this builder
	 */
	public GitHubExporterBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Set a custom GitHubClient implementation. The client is still wrapped with the
	 * run's rate limiter.
	 *
	 * <p>
	 * When a custom client is provided, the token is not required.
	 * @param httpClient custom GitHubClient implementation (null to use default)
	 * @return this builder
	 */
	public GitHubExporterBuilder httpClient(@Nullable GitHubClient httpClient) {
		this.httpClient = httpClient;
		return this;
	}

	/**
	 * Set a custom StateManager, e.g. one pointing at a temporary file.
	 * @param stateManager checkpoint store (null to use the configured state file)
	 * @return this builder
	 */
	public GitHubExporterBuilder stateManager(@Nullable StateManager stateManager) {
		this.stateManager = stateManager;
		return this;
	}

	/**
	 * Set a custom ExporterFactory, e.g. to add resource types.
	 * @param exporterFactory exporter factory (null to use the built-in exporters)
	 * @return this builder
	 */
	public GitHubExporterBuilder exporterFactory(@Nullable ExporterFactory exporterFactory) {
		this.exporterFactory = exporterFactory;
		return this;
	}

	public GitHubExporterBuilder progressListener(BatchProgressListener progressListener) {
		this.progressListener = progressListener;
		return this;
	}

	public GitHubExporterBuilder clock(Clock clock) {
		this.clock = clock;
		return this;
	}

	public GitHubExporterBuilder sleeper(Sleeper sleeper) {
		this.sleeper = sleeper;
		return this;
	}

	/**
	 * Build the exporter.
	 * @return configured GitHubExporter; close it when done
	 * @throws IllegalStateException if no token and no custom client were given
	 * @throws IllegalArgumentException if the configured eviction policy is unknown
	 */
	public GitHubExporter build() {
		validateToken();
		Components components = buildComponents();
		BatchProcessor processor = new BatchProcessor(components.apiService, components.exporterFactory,
				components.stateManager, components.rateLimiter, new BatchSummaryWriter(components.objectMapper, clock),
				progressListener);
		return new GitHubExporter(properties, components.apiService, components.rateLimiter, components.memoryCache,
				components.fileCache, components.stateManager, processor);
	}

	private void validateToken() {
		// Skip token validation if a custom httpClient is provided
		if (httpClient != null) {
			return;
		}
		if (token == null || token.trim().isEmpty()) {
			throw new IllegalStateException("GitHub token is required. Call token() or tokenFromEnv() first.");
		}
	}

	private Components buildComponents() {
		ObjectMapper mapper = (this.objectMapper != null) ? this.objectMapper : ObjectMapperFactory.create();
		GitHubClient upstream = (this.httpClient != null) ? this.httpClient
				: new GitHubHttpClient(token, apiUrl, properties.getRequestTimeout());

		// quota status must bypass the limiter
		GitHubRestService statusService = new GitHubRestService(upstream, mapper);
		RateLimiter limiter = RateLimiter.builder()
			.properties(properties)
			.statusSource(statusService::getRateLimit)
			.clock(clock)
			.sleeper(sleeper)
			.build();
		GitHubApiService apiService = new GitHubRestService(new RateLimitedGitHubClient(upstream, limiter), mapper);

		MemoryCache<Object> memoryCache = new MemoryCache<>(properties.getMemoryCacheMaxBytes(),
				properties.getMemoryCacheTtl(), EvictionPolicy.named(properties.getMemoryCacheEvictionPolicy()),
				properties.getMemoryCacheSweepInterval(), clock, mapper);
		FileResponseCache fileCache = null;
		if (properties.isCacheEnabled()) {
			fileCache = new FileResponseCache(properties.getCacheDirectory(), properties.getCacheTtl(), mapper, clock);
			fileCache.init();
		}
		StateManager state = (this.stateManager != null) ? this.stateManager
				: new StateManager(properties.getStateFile(), mapper, clock);

		ExporterContext context = new ExporterContext(apiService, properties, new FileSystemItemWriter(mapper),
				memoryCache, fileCache, sleeper);
		ExporterFactory factory = (this.exporterFactory != null) ? this.exporterFactory
				: new DefaultExporterFactory(context);

		return new Components(mapper, limiter, apiService, memoryCache, fileCache, state, factory);
	}

	/**
	 * Internal record to hold built components.
	 */
	private record Components(ObjectMapper objectMapper, RateLimiter rateLimiter, GitHubApiService apiService,
			MemoryCache<Object> memoryCache, @Nullable FileResponseCache fileCache, StateManager stateManager,
			ExporterFactory exporterFactory) {
	}

}
