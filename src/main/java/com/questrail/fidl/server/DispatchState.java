package com.questrail.fidl.server;

/**
 * States of a per-channel dispatch loop.
 *
 * <pre>
 *   IDLE → READING → DISPATCHING → IDLE
 *             │            │
 *             └────────────┴──→ TERMINATED
 * </pre>
 */
public enum DispatchState
{
    IDLE,
    READING,
    DISPATCHING,
    TERMINATED
}
