/**
 * Contract test infrastructure for fan-out engines.
 *
 * <p>Engine implementations extend {@link com.ryuqq.fanout.testkit.contract.AbstractFanOutContractTest}
 * and run against {@link com.ryuqq.fanout.testkit.contract.ScriptedCollaborators}.</p>
 */
package com.ryuqq.fanout.testkit.contract;
