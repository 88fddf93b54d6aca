/**
 * Delivery Order Price Calculator - prices delivery orders behind a health-aware load balancer.
 *
 * <p>A pricing instance fetches venue data from the upstream venue API through pooled,
 * health-swept connections and computes distance, delivery fee and small order surcharge.
 * The load balancer runs N such instances and round-robins client requests over the
 * healthy ones through an LMAX Disruptor forwarding pipeline.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.dopc.DopcApplication} - Entry point, balancer or standalone instance</li>
 *   <li>{@link fr.lapetina.dopc.LoadBalancer} - Backends, health checking and forwarding</li>
 *   <li>{@link fr.lapetina.dopc.PricingInstance} - One self-contained pricing backend</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * DopcConfig config = new ConfigLoader("config.yaml").load();
 * try (LoadBalancer balancer = LoadBalancer.create(config, "config.yaml").start()) {
 *     ForwardResponse response = balancer.forward(ForwardRequest.of(null,
 *             "venue_slug=home-assignment-venue-helsinki&cart_value=1000&user_lat=60.17&user_lon=24.93")).get();
 *     System.out.println(response.body());
 * }
 * }</pre>
 *
 * @see fr.lapetina.dopc.LoadBalancer
 * @see fr.lapetina.dopc.service.OrderPriceService
 */
package fr.lapetina.dopc;
