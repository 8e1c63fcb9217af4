/**
 * TaskDesk source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.taskdesk.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.taskdesk.cli.TaskDeskCommand} maps commands to runtime calls and starts the web server.</li>
 *   <li>{@code io.taskdesk.runtime.TaskDeskRuntime} composes the store, the query compiler and the audit log.</li>
 *   <li>{@code io.taskdesk.query.QueryCompiler} turns listing parameters into row and count queries.</li>
 *   <li>{@code io.taskdesk.storage.TaskStore} is the authoritative persistence layer.</li>
 * </ul>
 */
package io.taskdesk;
