/**
 * Runtime orchestration package.
 *
 * <p>{@link io.inboxflow.runtime.InboxflowRuntime} wires the vault's components for the CLI;
 * {@link io.inboxflow.runtime.ProcessingOrchestrator} runs processing batches over the pending store.
 */
package io.inboxflow.runtime;
