/**
 * Runner Adapter Layer - Factory 구현체.
 *
 * <p>application 계층 인터페이스의 구체적인 구현체와 그 설정을 포함합니다.</p>
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.factory.adapter.runner.DefaultPipelineEngine} - Foster/Develop/Hone 파이프라인</li>
 *   <li>{@link com.ryuqq.factory.adapter.runner.AlwaysOnController} - 수락 제어, 단계 순차 실행, 폴링</li>
 *   <li>{@link com.ryuqq.factory.adapter.runner.StallDetector} - 정체 Run 감지/만료</li>
 *   <li>{@link com.ryuqq.factory.adapter.runner.ArtifactHeuristicCheck} - 산출물 기반 기본 게이트 검증</li>
 *   <li>{@link com.ryuqq.factory.adapter.runner.FactoryAssembly} - 구성 요소 조립</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (AlwaysOnController, DefaultPipelineEngine)
 *   ↓ implements
 * application (FactoryController, PipelineEngine, PollingRuntime)
 *   ↓ depends on
 * core (Event, Manifest, Run, GateKind, RunTransition)
 *   ↓ depends on
 * core/spi (Store, EventQueue, CostEstimator, ContextRetriever, StepExecutor, VerificationCheck)
 * </pre>
 *
 * @author Factory Team
 * @since 1.0.0
 */
package com.ryuqq.factory.adapter.runner;
