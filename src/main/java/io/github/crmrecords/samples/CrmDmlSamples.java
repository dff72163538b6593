package io.github.crmrecords.samples;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.google.common.collect.Maps;
import io.github.crmrecords.CrmRecord;
import io.github.crmrecords.RecordStore;
import io.github.crmrecords.RecordUpsertHelper;
import io.github.crmrecords.WriteMode;
import io.github.crmrecords.condition.Condition;
import io.github.crmrecords.util.Checker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.github.crmrecords.schema.RecordType.ACCOUNT;
import static io.github.crmrecords.schema.RecordType.CASE;
import static io.github.crmrecords.schema.RecordType.CONTACT;
import static io.github.crmrecords.schema.RecordType.LEAD;
import static io.github.crmrecords.schema.RecordType.OPPORTUNITY;

/**
 * Short examples of create / update / upsert / delete on CRM records.
 *
 * <p>
 * Each method constructs one or a few records, optionally queries existing ones, writes them back,
 * and returns an id (or a count, or nothing).
 * </p>
 */
public class CrmDmlSamples {

    private static Logger log = LoggerFactory.getLogger(CrmDmlSamples.class);

    public static final String STAGE_PROSPECTING = "Prospecting";

    public static final String LEAD_STATUS_OPEN = "Open - Not Contacted";

    public static final String CASE_STATUS_NEW = "New";

    public static final String CASE_ORIGIN_WEB = "Web";

    final RecordStore store;

    public CrmDmlSamples(RecordStore store) {
        this.store = Checker.checkNotNull(store, "store");
    }

    /**
     * Q1. Create an Account with a name
     *
     * @param name account name
     * @return account id
     */
    public String createAccount(String name) {
        var account = new CrmRecord(ACCOUNT).put("Name", name);
        return store.create(account).getId();
    }

    /**
     * Q2. Create an Account and a Contact of it in one batch
     *
     * @param accountName account name
     * @param firstName   contact first name
     * @param lastName    contact last name
     * @return contact id
     */
    public String createAccountWithContact(String accountName, String firstName, String lastName) {
        var account = new CrmRecord(ACCOUNT).put("Name", accountName);
        var contact = new CrmRecord(CONTACT)
                .put("FirstName", firstName)
                .put("LastName", lastName)
                .put("AccountId", account);

        store.write(List.of(account, contact), WriteMode.CREATE);
        return contact.getId();
    }

    /**
     * Q3. Create Opportunities of an Account, all in stage "Prospecting"
     *
     * @param accountId account id
     * @param names     opportunity names
     * @param closeDate close date
     * @return opportunity ids in the order of names
     */
    public List<String> createOpportunities(String accountId, List<String> names, LocalDate closeDate) {
        var opportunities = names.stream().map(name -> new CrmRecord(OPPORTUNITY)
                        .put("Name", name)
                        .put("StageName", STAGE_PROSPECTING)
                        .put("CloseDate", closeDate)
                        .put("AccountId", accountId))
                .collect(Collectors.toList());

        return toIds(store.write(opportunities, WriteMode.CREATE));
    }

    /**
     * Q4. Change the industry of an Account
     *
     * @param accountId account id
     * @param industry  new industry
     */
    public void updateAccountIndustry(String accountId, String industry) {
        var account = store.read(ACCOUNT, accountId);
        account.put("Industry", industry);
        store.update(account);
    }

    /**
     * Q5. Move every Opportunity of an Account to a stage
     *
     * @param accountId account id
     * @param stageName new stage. e.g. "Closed Won"
     * @return number of opportunities updated
     */
    public int closeOpportunities(String accountId, String stageName) {
        var opportunities = store.query(OPPORTUNITY, Condition.filter("AccountId", accountId));
        opportunities.forEach(opportunity -> opportunity.put("StageName", stageName));
        store.write(opportunities, WriteMode.UPDATE);

        log.info("moved {} opportunities of account {} to {}", opportunities.size(), accountId, stageName);
        return opportunities.size();
    }

    /**
     * Q6. Create a Lead
     *
     * @param lastName last name
     * @param company  company
     * @param email    email
     * @return lead id
     */
    public String createLead(String lastName, String company, String email) {
        var lead = new CrmRecord(LEAD)
                .put("LastName", lastName)
                .put("Company", company)
                .put("Email", email)
                .put("Status", LEAD_STATUS_OPEN);
        return store.create(lead).getId();
    }

    /**
     * Q7. Delete every Case with a status
     *
     * @param status case status. e.g. "Closed"
     * @return number of cases deleted
     */
    public int deleteCasesByStatus(String status) {
        var cases = store.query(CASE, Condition.filter("Status", status));
        new RecordUpsertHelper(store, CASE).deleteAll(cases);
        return cases.size();
    }

    /**
     * Q8. Delete a Contact
     *
     * @param contactId contact id
     */
    public void deleteContact(String contactId) {
        var contact = store.read(CONTACT, contactId);
        store.delete(contact);
    }

    /**
     * Q9. Update the phone of the Account with the name, or insert a new Account if none exists
     *
     * @param name  account name
     * @param phone phone. null clears the phone of an existing account
     * @return account id
     */
    public String upsertAccount(String name, String phone) {
        Map<String, Object> fields = Maps.newHashMap();
        fields.put("Phone", phone);
        return new RecordUpsertHelper(store, ACCOUNT).findOrCreate(name, fields, fields).getId();
    }

    /**
     * Q10. Create or update Contacts by last name, all linked to an Account
     *
     * @param lastNames last names. duplicates allowed
     * @param accountId account id. null for contacts without an account
     * @return contact ids in the order of lastNames
     */
    public List<String> upsertContacts(List<String> lastNames, String accountId) {
        Map<String, Object> fields = Maps.newHashMap();
        fields.put("AccountId", accountId);
        var contacts = new RecordUpsertHelper(store, CONTACT).batchUpsertByName(lastNames, lastName -> fields);
        return toIds(contacts);
    }

    /**
     * Q11. Open a Case for a Contact, linked to the Contact and its Account
     *
     * @param contactId contact id
     * @param subject   subject
     * @return case id
     */
    public String createCase(String contactId, String subject) {
        var contact = store.read(CONTACT, contactId);
        var aCase = new CrmRecord(CASE)
                .put("Subject", subject)
                .put("Status", CASE_STATUS_NEW)
                .put("Origin", CASE_ORIGIN_WEB)
                .put("ContactId", contact)
                .put("AccountId", contact.getString("AccountId"));
        return store.create(aCase).getId();
    }

    static List<String> toIds(List<CrmRecord> records) {
        return records.stream().map(CrmRecord::getId).collect(Collectors.toList());
    }
}
