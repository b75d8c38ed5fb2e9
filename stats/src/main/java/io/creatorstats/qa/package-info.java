/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

/**
 * Declarative data quality rules: column typing, fill values and assertions.
 *
 * <p>Rules are loaded from YAML by {@link io.creatorstats.qa.QaConfigLoader}
 * and applied by {@link io.creatorstats.qa.RuleEvaluator}. Fatal violations
 * surface as subclasses of {@link io.creatorstats.qa.DataQualityException};
 * the rest are collected as {@link io.creatorstats.qa.ValidationWarning}s.
 */
package io.creatorstats.qa;
