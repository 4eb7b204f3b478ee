/*
 * Copyright 2024 Roman Khlebnov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.admission.supervision.repository;

import java.util.List;
import java.util.UUID;
import org.jooq.Field;
import org.jooq.Record;
import org.jooq.Table;
import org.jooq.impl.DSL;
import org.jooq.impl.SQLDataType;

/** Tables created by {@code db/supervision.sql}. */
final class SupervisionTables {
  static final Table<Record> SUPERVISION_GROUP = DSL.table(DSL.name("supervision_group"));
  static final Field<UUID> GROUP_ID = DSL.field(DSL.name("id"), SQLDataType.UUID);
  static final Field<UUID> GROUP_PROPOSITION_ID =
      DSL.field(DSL.name("proposition_id"), SQLDataType.UUID);
  static final Field<String> GROUP_STATUS =
      DSL.field(DSL.name("status"), SQLDataType.VARCHAR(32));
  static final Field<String> GROUP_REFERENCE_PROMOTER_ID =
      DSL.field(DSL.name("reference_promoter_id"), SQLDataType.VARCHAR(64));
  static final Field<Boolean> GROUP_COTUTELLE_ANSWERED =
      DSL.field(DSL.name("cotutelle_answered"), SQLDataType.BOOLEAN);
  static final Field<String> GROUP_COTUTELLE_MOTIVATION =
      DSL.field(DSL.name("cotutelle_motivation"), SQLDataType.VARCHAR(4000));
  static final Field<Boolean> GROUP_COTUTELLE_PARTNER_CONSORTIUM =
      DSL.field(DSL.name("cotutelle_partner_consortium"), SQLDataType.BOOLEAN);
  static final Field<String> GROUP_COTUTELLE_INSTITUTION =
      DSL.field(DSL.name("cotutelle_institution"), SQLDataType.VARCHAR(255));
  static final Field<String> GROUP_COTUTELLE_OTHER_INSTITUTION_NAME =
      DSL.field(DSL.name("cotutelle_other_institution_name"), SQLDataType.VARCHAR(255));
  static final Field<String> GROUP_COTUTELLE_OTHER_INSTITUTION_ADDRESS =
      DSL.field(DSL.name("cotutelle_other_institution_address"), SQLDataType.VARCHAR(255));
  static final Field<Long> GROUP_VERSION = DSL.field(DSL.name("version"), SQLDataType.BIGINT);

  static final List<Field<?>> GROUP_FIELDS =
      List.of(
          GROUP_ID,
          GROUP_PROPOSITION_ID,
          GROUP_STATUS,
          GROUP_REFERENCE_PROMOTER_ID,
          GROUP_COTUTELLE_ANSWERED,
          GROUP_COTUTELLE_MOTIVATION,
          GROUP_COTUTELLE_PARTNER_CONSORTIUM,
          GROUP_COTUTELLE_INSTITUTION,
          GROUP_COTUTELLE_OTHER_INSTITUTION_NAME,
          GROUP_COTUTELLE_OTHER_INSTITUTION_ADDRESS,
          GROUP_VERSION);

  static final Table<Record> SUPERVISION_SIGNATURE = DSL.table(DSL.name("supervision_signature"));
  static final Field<UUID> SIGNATURE_GROUP_ID = DSL.field(DSL.name("group_id"), SQLDataType.UUID);
  static final Field<String> SIGNATURE_SIGNATORY_ID =
      DSL.field(DSL.name("signatory_id"), SQLDataType.VARCHAR(64));
  static final Field<String> SIGNATURE_ROLE = DSL.field(DSL.name("role"), SQLDataType.VARCHAR(16));
  static final Field<Integer> SIGNATURE_SORT_INDEX =
      DSL.field(DSL.name("sort_index"), SQLDataType.INTEGER);
  static final Field<String> SIGNATURE_STATE =
      DSL.field(DSL.name("state"), SQLDataType.VARCHAR(16));
  static final Field<String> SIGNATURE_INTERNAL_COMMENT =
      DSL.field(DSL.name("internal_comment"), SQLDataType.VARCHAR(4000));
  static final Field<String> SIGNATURE_EXTERNAL_COMMENT =
      DSL.field(DSL.name("external_comment"), SQLDataType.VARCHAR(4000));
  static final Field<String> SIGNATURE_REFUSAL_REASON =
      DSL.field(DSL.name("refusal_reason"), SQLDataType.VARCHAR(4000));

  static final Table<Record> SUPERVISION_EXTERNAL_MEMBER =
      DSL.table(DSL.name("supervision_external_member"));
  static final Field<UUID> EXTERNAL_GROUP_ID = DSL.field(DSL.name("group_id"), SQLDataType.UUID);
  static final Field<String> EXTERNAL_SIGNATORY_ID =
      DSL.field(DSL.name("signatory_id"), SQLDataType.VARCHAR(64));
  static final Field<String> EXTERNAL_FIRST_NAME =
      DSL.field(DSL.name("first_name"), SQLDataType.VARCHAR(255));
  static final Field<String> EXTERNAL_LAST_NAME =
      DSL.field(DSL.name("last_name"), SQLDataType.VARCHAR(255));
  static final Field<String> EXTERNAL_EMAIL =
      DSL.field(DSL.name("email"), SQLDataType.VARCHAR(255));
  static final Field<Boolean> EXTERNAL_DOCTOR =
      DSL.field(DSL.name("doctor"), SQLDataType.BOOLEAN);
  static final Field<String> EXTERNAL_INSTITUTION =
      DSL.field(DSL.name("institution"), SQLDataType.VARCHAR(255));
  static final Field<String> EXTERNAL_CITY = DSL.field(DSL.name("city"), SQLDataType.VARCHAR(255));
  static final Field<String> EXTERNAL_COUNTRY =
      DSL.field(DSL.name("country"), SQLDataType.VARCHAR(8));
  static final Field<String> EXTERNAL_LANGUAGE =
      DSL.field(DSL.name("language"), SQLDataType.VARCHAR(8));

  static final List<Field<?>> EXTERNAL_FIELDS =
      List.of(
          EXTERNAL_SIGNATORY_ID,
          EXTERNAL_FIRST_NAME,
          EXTERNAL_LAST_NAME,
          EXTERNAL_EMAIL,
          EXTERNAL_DOCTOR,
          EXTERNAL_INSTITUTION,
          EXTERNAL_CITY,
          EXTERNAL_COUNTRY,
          EXTERNAL_LANGUAGE);

  static final Table<Record> SUPERVISION_DOCUMENT = DSL.table(DSL.name("supervision_document"));
  static final Field<UUID> DOCUMENT_GROUP_ID = DSL.field(DSL.name("group_id"), SQLDataType.UUID);
  static final Field<String> DOCUMENT_KIND = DSL.field(DSL.name("kind"), SQLDataType.VARCHAR(32));
  static final Field<String> DOCUMENT_OWNER =
      DSL.field(DSL.name("owner_id"), SQLDataType.VARCHAR(64));
  static final Field<Integer> DOCUMENT_SORT_INDEX =
      DSL.field(DSL.name("sort_index"), SQLDataType.INTEGER);
  static final Field<String> DOCUMENT_REFERENCE =
      DSL.field(DSL.name("document_reference"), SQLDataType.VARCHAR(255));

  private SupervisionTables() {
    // Cannot be instantiated
  }
}
