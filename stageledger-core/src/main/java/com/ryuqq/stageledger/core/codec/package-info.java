/**
 * JSON (de)serialization of the state document, backed by Jackson's tree model.
 *
 * @since 1.0.0
 * @author StageLedger Team
 */
package com.ryuqq.stageledger.core.codec;
