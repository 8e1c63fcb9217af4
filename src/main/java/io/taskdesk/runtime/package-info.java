/**
 * Runtime composition package.
 *
 * <p>{@link io.taskdesk.runtime.TaskDeskRuntime} is created once per process, initialized
 * explicitly, and shared by the CLI commands and the web server.
 */
package io.taskdesk.runtime;
