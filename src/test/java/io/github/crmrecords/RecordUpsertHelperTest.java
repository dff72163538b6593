package io.github.crmrecords;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import ch.qos.logback.classic.Level;
import io.github.crmrecords.condition.Condition;
import io.github.crmrecords.impl.memory.InMemoryRecordStore;
import io.github.crmrecords.schema.RecordType;
import io.github.crmrecords.util.LogTracker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecordUpsertHelperTest {

    CountingRecordStore store;

    RecordUpsertHelper accounts;

    RecordUpsertHelper contacts;

    @BeforeEach
    void beforeEach() {
        store = new CountingRecordStore(new InMemoryRecordStore());
        accounts = new RecordUpsertHelper(store, RecordType.ACCOUNT);
        contacts = new RecordUpsertHelper(store, RecordType.CONTACT);
    }

    @Test
    void constructor_should_check_arguments() {
        assertThatThrownBy(() -> new RecordUpsertHelper(null, RecordType.ACCOUNT))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("store");
        assertThatThrownBy(() -> new RecordUpsertHelper(store, null))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("type");
    }

    @Test
    void findOrCreate_should_create_on_empty_store() {

        var ibm = accounts.findOrCreate("IBM", Map.of("NumberOfEmployees", 282200));

        assertThat(ibm.getId()).startsWith("001").hasSize(18);
        assertThat(ibm.isPersistent()).isTrue();
        assertThat(ibm.getString("Name")).isEqualTo("IBM");
        assertThat(ibm.getNumber("NumberOfEmployees")).isEqualTo(282200);

        var read = store.read(RecordType.ACCOUNT, ibm.getId());
        assertThat(read.getNumber("NumberOfEmployees")).isEqualTo(282200);

        // one query and one create
        assertThat(store.queries).isEqualTo(1);
        assertThat(store.writes).isEqualTo(1);
        assertThat(store.writeModes).containsExactly(WriteMode.CREATE);
    }

    @Test
    void findOrCreate_should_be_idempotent_on_natural_key() {

        var first = accounts.findOrCreate("IBM", Map.of("NumberOfEmployees", 282200));
        var second = accounts.findOrCreate("IBM", Map.of("NumberOfEmployees", 1));

        assertThat(second.getId()).isEqualTo(first.getId());
        // default fields are not applied to an existing record
        assertThat(second.getNumber("NumberOfEmployees")).isEqualTo(282200);
        assertThat(store.count(RecordType.ACCOUNT, Condition.filter("Name", "IBM"))).isEqualTo(1);

        // the second call still issues exactly one write, as an update
        assertThat(store.writeModes).containsExactly(WriteMode.CREATE, WriteMode.UPDATE);
    }

    @Test
    void findOrCreate_should_apply_update_fields_to_existing_record() {

        var created = accounts.findOrCreate("Acme", Map.of("Phone", "111"), Map.of("Phone", "222"));
        assertThat(created.getString("Phone")).isEqualTo("111");

        var updated = accounts.findOrCreate("Acme", Map.of("Phone", "111"), Map.of("Phone", "222", "Industry", "Retail"));
        assertThat(updated.getId()).isEqualTo(created.getId());
        assertThat(updated.getString("Phone")).isEqualTo("222");

        var read = store.read(RecordType.ACCOUNT, created.getId());
        assertThat(read.getString("Phone")).isEqualTo("222");
        assertThat(read.getString("Industry")).isEqualTo("Retail");
    }

    @Test
    void findOrCreate_should_pick_one_of_duplicates() {

        var a1 = store.create(CrmRecord.of(RecordType.ACCOUNT, Map.of("Name", "Dup", "Phone", "1")));
        var a2 = store.create(CrmRecord.of(RecordType.ACCOUNT, Map.of("Name", "Dup", "Phone", "2")));

        var picked = accounts.findOrCreate("Dup", Map.of(), Map.of("Rating", "Hot"));

        assertThat(picked.getId()).isIn(a1.getId(), a2.getId());
        assertThat(store.count(RecordType.ACCOUNT, Condition.filter("Name", "Dup"))).isEqualTo(2);
        assertThat(store.count(RecordType.ACCOUNT, Condition.filter("Rating", "Hot"))).isEqualTo(1);
    }

    @Test
    void findOrCreate_should_reject_empty_natural_key_without_store_call() {

        for (var key : new String[]{null, "", "  "}) {
            assertThatThrownBy(() -> accounts.findOrCreate(key, Map.of()))
                    .isInstanceOfSatisfying(RecordException.class, re -> {
                        assertThat(re.getStatusCode()).isEqualTo(400);
                        assertThat(re.getCode()).isEqualTo(RecordException.VALIDATION_ERROR);
                        assertThat(re.getMessage()).contains("Account.Name");
                    });
        }
        assertThat(store.roundTrips()).isZero();
    }

    @Test
    void findOrCreate_should_surface_invalid_default_fields() {
        assertThatThrownBy(() -> accounts.findOrCreate("IBM", Map.of("NoSuchField", "x")))
                .isInstanceOfSatisfying(RecordException.class, re -> assertThat(re.isValidationError()).isTrue());
        assertThat(store.count(RecordType.ACCOUNT, null)).isZero();
    }

    @Test
    void findOrCreate_should_log_decision() {
        var tracker = LogTracker.getInstance(RecordUpsertHelper.class);
        try {
            accounts.findOrCreate("Logged", Map.of());
            accounts.findOrCreate("Logged", Map.of());

            assertThat(tracker.getMessages(Level.DEBUG))
                    .anySatisfy(m -> assertThat(m).contains("no Account Name=Logged found, creating"))
                    .anySatisfy(m -> assertThat(m).startsWith("found Account Name=Logged"));
        } finally {
            tracker.detach();
        }
    }

    @Test
    void batchUpsertByName_should_keep_input_length_and_order_with_duplicates() {

        var calls = new ArrayList<String>();
        var result = contacts.batchUpsertByName(List.of("Doe", "Jane", "Doe"), lastName -> {
            calls.add(lastName);
            return Map.of("Title", "Engineer");
        });

        assertThat(result).hasSize(3);
        assertThat(result.get(0)).isSameAs(result.get(2));
        assertThat(result.get(0).getString("LastName")).isEqualTo("Doe");
        assertThat(result.get(1).getString("LastName")).isEqualTo("Jane");
        assertThat(result).allSatisfy(c -> {
            assertThat(c.getId()).startsWith("003");
            assertThat(c.getString("Title")).isEqualTo("Engineer");
        });

        // 2 records created, factory called once per distinct key
        assertThat(store.count(RecordType.CONTACT, null)).isEqualTo(2);
        assertThat(calls).containsExactly("Doe", "Jane");

        // one query and one batch write of the distinct records
        assertThat(store.queries).isEqualTo(1);
        assertThat(store.writes).isEqualTo(1);
        assertThat(store.writeModes).containsExactly(WriteMode.UPSERT);
        assertThat(store.writeSizes).containsExactly(2);
    }

    @Test
    void batchUpsertByName_should_update_existing_and_create_missing() {

        var doe = store.create(CrmRecord.of(RecordType.CONTACT, Map.of("LastName", "Doe", "Email", "old@example.com")));

        var result = contacts.batchUpsertByName(List.of("Smith", "Doe"),
                lastName -> Map.of("Email", lastName.toLowerCase() + "@example.com"));

        assertThat(result).hasSize(2);
        assertThat(result.get(1).getId()).isEqualTo(doe.getId());
        assertThat(result.get(0).getId()).isNotEqualTo(doe.getId());

        assertThat(store.read(RecordType.CONTACT, doe.getId()).getString("Email")).isEqualTo("doe@example.com");
        assertThat(store.read(RecordType.CONTACT, result.get(0).getId()).getString("Email")).isEqualTo("smith@example.com");
        assertThat(store.count(RecordType.CONTACT, null)).isEqualTo(2);
    }

    @Test
    void batchUpsertByName_should_be_idempotent() {

        var first = contacts.batchUpsertByName(List.of("A", "B"), lastName -> Map.of());
        var second = contacts.batchUpsertByName(List.of("B", "A", "C"), lastName -> Map.of());

        assertThat(second.get(0).getId()).isEqualTo(first.get(1).getId());
        assertThat(second.get(1).getId()).isEqualTo(first.get(0).getId());
        assertThat(store.count(RecordType.CONTACT, null)).isEqualTo(3);
    }

    @Test
    void batchUpsertByName_should_handle_irregular_input() {

        // empty input, no store call
        assertThat(contacts.batchUpsertByName(List.of(), lastName -> Map.of())).isEmpty();
        assertThat(store.roundTrips()).isZero();

        // empty key fails before any store call
        assertThatThrownBy(() -> contacts.batchUpsertByName(List.of("Doe", ""), lastName -> Map.of()))
                .isInstanceOfSatisfying(RecordException.class, re -> assertThat(re.getCode()).isEqualTo("ValidationError"));
        assertThat(store.roundTrips()).isZero();

        assertThatThrownBy(() -> contacts.batchUpsertByName(null, lastName -> Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> contacts.batchUpsertByName(List.of("Doe"), null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void batchUpsertByName_should_fail_as_a_unit() {

        // Lead requires Company, so a factory without it fails the whole batch
        var leads = new RecordUpsertHelper(store, RecordType.LEAD);
        assertThatThrownBy(() -> leads.batchUpsertByName(List.of("Ok", "Ng"),
                lastName -> "Ok".equals(lastName) ? Map.<String, Object>of("Company", "Acme") : Map.<String, Object>of()))
                .isInstanceOfSatisfying(RecordException.class, re -> assertThat(re.getMessage()).contains("Company"));

        assertThat(store.count(RecordType.LEAD, null)).isZero();
    }

    @Test
    void output_length_should_equal_input_length() {
        var inputs = List.of(
                List.of("x"),
                List.of("x", "x", "x"),
                List.of("a", "b", "a", "c", "b"),
                List.of("p", "q", "r", "s"));

        for (var input : inputs) {
            assertThat(contacts.batchUpsertByName(input, lastName -> Map.of())).hasSameSizeAs(input);
        }
    }

    @Test
    void batchUpsertByName_should_keep_input_length_for_large_batch() {

        var lastNames = new ArrayList<String>();
        for (int i = 0; i <= 200; i++) {
            lastNames.add("A" + i);
        }

        var result = contacts.batchUpsertByName(lastNames, lastName -> Map.of());

        assertThat(result).hasSize(201);
        assertThat(result.get(200).getString("LastName")).isEqualTo("A200");
        assertThat(store.queries).isEqualTo(1);
        assertThat(store.writeSizes).containsExactly(201);
        assertThat(store.count(RecordType.CONTACT, null)).isEqualTo(201);
    }

    @Test
    void findOrCreate_should_keep_natural_key_against_update_fields() {

        var created = accounts.findOrCreate("IBM", Map.of());
        var updated = accounts.findOrCreate("IBM", Map.of(), Map.of("Name", "X", "Phone", "111"));

        assertThat(updated.getId()).isEqualTo(created.getId());
        assertThat(updated.getString("Name")).isEqualTo("IBM");
        assertThat(updated.getString("Phone")).isEqualTo("111");

        var again = accounts.findOrCreate("IBM", Map.of());
        assertThat(again.getId()).isEqualTo(created.getId());
        assertThat(store.count(RecordType.ACCOUNT, null)).isEqualTo(1);
        assertThat(store.count(RecordType.ACCOUNT, Condition.filter("Name", "X"))).isZero();
    }

    @Test
    void findOrCreate_should_keep_natural_key_against_default_fields() {

        var created = accounts.findOrCreate("IBM", Map.of("Name", "X"));

        assertThat(created.getString("Name")).isEqualTo("IBM");
        assertThat(accounts.findByName("IBM")).extracting(CrmRecord::getId).containsExactly(created.getId());
    }

    @Test
    void batchUpsertByName_should_keep_natural_key_against_factory_fields() {

        var doe = store.create(CrmRecord.of(RecordType.CONTACT, Map.of("LastName", "Doe")));

        var result = contacts.batchUpsertByName(List.of("Doe", "Smith"),
                lastName -> Map.of("LastName", "Other", "Email", lastName + "@example.com"));

        assertThat(result).extracting(r -> r.getString("LastName")).containsExactly("Doe", "Smith");
        assertThat(result.get(0).getId()).isEqualTo(doe.getId());
        assertThat(store.read(RecordType.CONTACT, doe.getId()).getString("Email")).isEqualTo("Doe@example.com");
        assertThat(store.count(RecordType.CONTACT, Condition.filter("LastName", "Other"))).isZero();
    }

    @Test
    void deleteAll_should_work() {

        var result = contacts.batchUpsertByName(List.of("Doe", "Jane", "Doe"), lastName -> Map.of());

        // duplicates in the list are deleted once
        contacts.deleteAll(result);

        assertThat(result).allSatisfy(c -> assertThat(c.isDeleted()).isTrue());
        assertThat(store.count(RecordType.CONTACT, null)).isZero();
        assertThat(store.deletes).isEqualTo(1);
    }

    @Test
    void deleteAll_of_empty_list_should_be_noop() {
        contacts.deleteAll(List.of());
        assertThat(store.roundTrips()).isZero();
    }

    @Test
    void deleteAll_should_fail_with_not_found() {

        var persisted = contacts.findOrCreate("Doe", Map.of());
        var transientRecord = CrmRecord.of(RecordType.CONTACT, Map.of("LastName", "Never"));

        // never persisted
        assertThatThrownBy(() -> contacts.deleteAll(List.of(persisted, transientRecord)))
                .isInstanceOfSatisfying(RecordException.class, re -> {
                    assertThat(re.getStatusCode()).isEqualTo(404);
                    assertThat(re.getCode()).isEqualTo(RecordException.NOT_FOUND);
                });
        // nothing deleted
        assertThat(persisted.isPersistent()).isTrue();
        assertThat(store.count(RecordType.CONTACT, null)).isEqualTo(1);

        // already deleted
        contacts.deleteAll(List.of(persisted));
        assertThatThrownBy(() -> contacts.deleteAll(List.of(persisted)))
                .isInstanceOfSatisfying(RecordException.class, re -> assertThat(re.isNotFound()).isTrue());
    }

    @Test
    void write_after_delete_should_fail_with_stale_reference() {

        var ibm = accounts.findOrCreate("IBM", Map.of());
        var copy = store.read(RecordType.ACCOUNT, ibm.getId());
        accounts.deleteAll(List.of(ibm));

        ibm.put("Phone", "123");
        assertThatThrownBy(() -> store.update(ibm))
                .isInstanceOfSatisfying(RecordException.class, re -> {
                    assertThat(re.getStatusCode()).isEqualTo(410);
                    assertThat(re.getCode()).isEqualTo(RecordException.STALE_REFERENCE);
                });
        assertThatThrownBy(() -> store.upsert(ibm))
                .isInstanceOfSatisfying(RecordException.class, re -> assertThat(re.isStaleReference()).isTrue());

        // another instance of the deleted record is stale as well
        assertThatThrownBy(() -> store.update(copy.put("Phone", "456")))
                .isInstanceOfSatisfying(RecordException.class, re -> assertThat(re.isStaleReference()).isTrue());

        // the natural key is free again, so findOrCreate creates a new record
        var recreated = accounts.findOrCreate("IBM", Map.of());
        assertThat(recreated.getId()).isNotEqualTo(ibm.getId());
    }
}
