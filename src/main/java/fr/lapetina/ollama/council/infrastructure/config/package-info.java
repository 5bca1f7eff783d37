/**
 * Configuration loading and hot-reload support.
 *
 * <p>YAML is mapped onto {@link fr.lapetina.ollama.council.infrastructure.config.CouncilConfig}
 * by SnakeYAML. Reloaded files are validated before listeners see them, so a broken edit never
 * replaces a working roster.
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code server} - HTTP server settings (port, backlog)</li>
 *   <li>{@code ollama} - model host URL and connect timeout</li>
 *   <li>{@code timeouts} - per-call and title timeouts</li>
 *   <li>{@code council} - persona prompt directory, synthesis failure policy</li>
 *   <li>{@code advisors} - the roster, in order</li>
 *   <li>{@code chairman} - the synthesizing model</li>
 *   <li>{@code title} - conversation title generation</li>
 *   <li>{@code metrics} - Prometheus metrics configuration</li>
 * </ul>
 */
package fr.lapetina.ollama.council.infrastructure.config;
