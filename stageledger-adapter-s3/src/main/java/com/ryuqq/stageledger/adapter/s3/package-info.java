/**
 * Amazon S3 adapter for the Backend SPI, built on the AWS SDK for Java v2.
 *
 * <p>{@link com.ryuqq.stageledger.adapter.s3.S3Backend} stores each state document as one
 * object. The {@link software.amazon.awssdk.services.s3.S3Client} is created and owned by
 * the caller, so credentials, region and HTTP timeouts stay outside this module.</p>
 *
 * @see com.ryuqq.stageledger.core.spi.Backend
 * @author StageLedger Team
 * @since 1.0.0
 */
package com.ryuqq.stageledger.adapter.s3;
