/**
 * YAML configuration model and loader.
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code general} - Host, client port, pricing endpoint, balancer on/off</li>
 *   <li>{@code server} - Listener backlog and worker threads</li>
 *   <li>{@code balancer} - Backend ports, launch mode, health check and forwarding timeouts</li>
 *   <li>{@code disruptor} - Ring buffer size and wait strategy</li>
 *   <li>{@code service} - Admission capacity per instance</li>
 *   <li>{@code upstream} - Venue API URLs, pool size and sweep interval</li>
 *   <li>{@code metrics} - Metric name prefix</li>
 * </ul>
 */
package fr.lapetina.dopc.infrastructure.config;
