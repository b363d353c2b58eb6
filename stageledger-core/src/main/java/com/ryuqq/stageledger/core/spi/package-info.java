/**
 * Service Provider Interface (SPI) package.
 *
 * <p>Defines {@link com.ryuqq.stageledger.core.spi.Backend}, implemented by the adapter
 * modules to store state document bytes on a concrete medium.</p>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Dependency Inversion:</strong> Core does not depend on any storage SDK</li>
 *   <li><strong>Pluggability:</strong> One StateStore works with every Backend</li>
 * </ul>
 *
 * @since 1.0.0
 * @author StageLedger Team
 */
package com.ryuqq.stageledger.core.spi;
