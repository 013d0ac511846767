/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

/// # Exponential Families for GLM Fitting
///
/// The one-parameter exponential families an IRLS loop drives, each pairing
/// a link with a variance function.
///
/// ```text
///  Family            │ V(μ)           │ Default link   │ Mean domain
/// ───────────────────┼────────────────┼────────────────┼─────────────
///  Gaussian          │ 1              │ identity       │ (-∞, +∞)
///  Poisson           │ μ              │ log            │ [0, +∞)
///  QuasiPoisson      │ μ              │ log            │ [0, +∞)
///  Gamma             │ μ²             │ inverse_power  │ [0, +∞)
///  Binomial          │ μ(1-μ)·n       │ logit          │ [0, 1]
///  NegativeBinomial  │ μ + αμ²        │ log            │ [0, +∞)
/// ───────────────────┴────────────────┴────────────────┴─────────────
/// ```
///
/// ## Construction
///
/// Families are immutable once built. The link is validated by the
/// constructor; [io.nosqlbench.glm.family.FamilyKind] adds a type check
/// for links arriving as untyped objects. Binomial's trial counts are
/// configured by [io.nosqlbench.glm.family.Binomial#initialize(double[][])],
/// which returns a new family rather than mutating the receiver.
///
/// ## Errors
///
/// - [io.nosqlbench.glm.family.InvalidLinkTypeException]: the link is not a link
/// - [io.nosqlbench.glm.family.InvalidLinkChoiceException]: the family does not accept the link
///
/// Numeric boundary conditions never throw; NaN and infinities propagate.
package io.nosqlbench.glm.family;
