/**
 * Pooled access to the upstream venue API.
 */
package fr.lapetina.dopc.infrastructure.upstream;
