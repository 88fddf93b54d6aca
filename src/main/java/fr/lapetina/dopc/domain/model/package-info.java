/**
 * Domain model classes for delivery pricing and request forwarding.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.dopc.domain.model.DeliveryOrderRequest} - Validated client price request</li>
 *   <li>{@link fr.lapetina.dopc.domain.model.VenueStaticData} / {@link fr.lapetina.dopc.domain.model.VenueDynamicData} - Parsed upstream venue data</li>
 *   <li>{@link fr.lapetina.dopc.domain.model.DeliveryPriceResponse} - Priced order; the total is checked against its components</li>
 *   <li>{@link fr.lapetina.dopc.domain.model.Outcome} - Value-or-error result of a pipeline step</li>
 *   <li>{@link fr.lapetina.dopc.domain.model.BackendInstance} - Thread-safe view of a pricing instance behind the balancer</li>
 *   <li>{@link fr.lapetina.dopc.domain.model.ErrorType} - Error taxonomy with HTTP status mapping</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>Records in this package are immutable. {@code BackendInstance} keeps its health in an
 * {@code AtomicReference} and its last-checked time in a volatile field.
 */
package fr.lapetina.dopc.domain.model;
