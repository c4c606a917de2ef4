/**
 * Inboxflow source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.inboxflow.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.inboxflow.cli.InboxflowCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.inboxflow.watch.InboxWatcher} turns Inbox drops into tasks.</li>
 *   <li>{@code io.inboxflow.runtime.ProcessingOrchestrator} moves pending tasks to done or failed.</li>
 *   <li>{@code io.inboxflow.storage.TaskStore} and {@code io.inboxflow.storage.LedgerStore} own everything on disk.</li>
 * </ul>
 */
package io.inboxflow;
