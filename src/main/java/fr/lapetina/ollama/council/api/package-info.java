/**
 * HTTP surface of the council: JSON endpoints, a Server-Sent Events stream of deliberation
 * progress, and the monitoring endpoints.
 */
package fr.lapetina.ollama.council.api;
