package fr.lapetina.dopc.infrastructure.config;

/**
 * Root configuration object for the pricing service and the load balancer.
 * Designed to be populated from YAML.
 */
public class DopcConfig {

    private GeneralConfig general = new GeneralConfig();
    private ServerConfig server = new ServerConfig();
    private BalancerConfig balancer = new BalancerConfig();
    private DisruptorConfig disruptor = new DisruptorConfig();
    private ServiceConfig service = new ServiceConfig();
    private UpstreamConfig upstream = new UpstreamConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public GeneralConfig getGeneral() { return general; }
    public void setGeneral(GeneralConfig general) { this.general = general; }

    public ServerConfig getServer() { return server; }
    public void setServer(ServerConfig server) { this.server = server; }

    public BalancerConfig getBalancer() { return balancer; }
    public void setBalancer(BalancerConfig balancer) { this.balancer = balancer; }

    public DisruptorConfig getDisruptor() { return disruptor; }
    public void setDisruptor(DisruptorConfig disruptor) { this.disruptor = disruptor; }

    public ServiceConfig getService() { return service; }
    public void setService(ServiceConfig service) { this.service = service; }

    public UpstreamConfig getUpstream() { return upstream; }
    public void setUpstream(UpstreamConfig upstream) { this.upstream = upstream; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Settings shared by the balancer and the pricing instances.
     */
    public static class GeneralConfig {
        private String host = "localhost";
        private int port = 8000;
        private String endpoint = "/api/v1/delivery-order-price";
        private boolean useBalancer = true;

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public String getEndpoint() { return endpoint; }
        public void setEndpoint(String endpoint) { this.endpoint = endpoint; }

        public boolean isUseBalancer() { return useBalancer; }
        public void setUseBalancer(boolean useBalancer) { this.useBalancer = useBalancer; }
    }

    /**
     * HTTP listener configuration.
     */
    public static class ServerConfig {
        private int backlog = 100;
        private int workerThreads = 64;
        private int stopDelaySeconds = 1;

        public int getBacklog() { return backlog; }
        public void setBacklog(int backlog) { this.backlog = backlog; }

        public int getWorkerThreads() { return workerThreads; }
        public void setWorkerThreads(int workerThreads) { this.workerThreads = workerThreads; }

        public int getStopDelaySeconds() { return stopDelaySeconds; }
        public void setStopDelaySeconds(int stopDelaySeconds) { this.stopDelaySeconds = stopDelaySeconds; }
    }

    /**
     * Load balancer configuration.
     */
    public static class BalancerConfig {
        private int servicePortStart = 8001;
        private int numServices = 3;
        private String launchMode = "in-process";
        private long processStartupDelayMs = 2000;
        private long healthCheckIntervalMs = 5000;
        private long healthCheckTimeoutMs = 2000;
        private long forwardTimeoutMs = 5000;
        private long connectTimeoutMs = 2000;

        public int getServicePortStart() { return servicePortStart; }
        public void setServicePortStart(int servicePortStart) { this.servicePortStart = servicePortStart; }

        public int getNumServices() { return numServices; }
        public void setNumServices(int numServices) { this.numServices = numServices; }

        public String getLaunchMode() { return launchMode; }
        public void setLaunchMode(String launchMode) { this.launchMode = launchMode; }

        public long getProcessStartupDelayMs() { return processStartupDelayMs; }
        public void setProcessStartupDelayMs(long ms) { this.processStartupDelayMs = ms; }

        public long getHealthCheckIntervalMs() { return healthCheckIntervalMs; }
        public void setHealthCheckIntervalMs(long ms) { this.healthCheckIntervalMs = ms; }

        public long getHealthCheckTimeoutMs() { return healthCheckTimeoutMs; }
        public void setHealthCheckTimeoutMs(long ms) { this.healthCheckTimeoutMs = ms; }

        public long getForwardTimeoutMs() { return forwardTimeoutMs; }
        public void setForwardTimeoutMs(long forwardTimeoutMs) { this.forwardTimeoutMs = forwardTimeoutMs; }

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }
    }

    /**
     * LMAX Disruptor configuration for the forwarding pipeline.
     */
    public static class DisruptorConfig {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";

        public int getRingBufferSize() { return ringBufferSize; }
        public void setRingBufferSize(int ringBufferSize) { this.ringBufferSize = ringBufferSize; }

        public String getWaitStrategy() { return waitStrategy; }
        public void setWaitStrategy(String waitStrategy) { this.waitStrategy = waitStrategy; }
    }

    /**
     * Pricing service configuration.
     */
    public static class ServiceConfig {
        private int maxConcurrentRequests = 100;

        public int getMaxConcurrentRequests() { return maxConcurrentRequests; }
        public void setMaxConcurrentRequests(int max) { this.maxConcurrentRequests = max; }
    }

    /**
     * Upstream venue API and connection pool configuration.
     */
    public static class UpstreamConfig {
        private String baseUrl = "https://consumer-api.development.dev.woltapi.com/home-assignment-api/v1";
        private String mockBaseUrl = "http://localhost:10000/home-assignment-api/v1";
        private boolean useMock = false;
        private int poolSize = 5;
        private long healthCheckIntervalMs = 30000;
        private long requestTimeoutMs = 30000;
        private long connectTimeoutMs = 10000;
        private String probeVenueSlug = "home-assignment-venue-helsinki";

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getMockBaseUrl() { return mockBaseUrl; }
        public void setMockBaseUrl(String mockBaseUrl) { this.mockBaseUrl = mockBaseUrl; }

        public boolean isUseMock() { return useMock; }
        public void setUseMock(boolean useMock) { this.useMock = useMock; }

        public int getPoolSize() { return poolSize; }
        public void setPoolSize(int poolSize) { this.poolSize = poolSize; }

        public long getHealthCheckIntervalMs() { return healthCheckIntervalMs; }
        public void setHealthCheckIntervalMs(long ms) { this.healthCheckIntervalMs = ms; }

        public long getRequestTimeoutMs() { return requestTimeoutMs; }
        public void setRequestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }

        public String getProbeVenueSlug() { return probeVenueSlug; }
        public void setProbeVenueSlug(String probeVenueSlug) { this.probeVenueSlug = probeVenueSlug; }

        /**
         * Returns the base URL in effect, honoring the mock flag.
         */
        public String effectiveBaseUrl() {
            return useMock ? mockBaseUrl : baseUrl;
        }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private String prefix = "dopc";

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
