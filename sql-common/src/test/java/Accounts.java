import com.fasterxml.jackson.databind.JsonNode;
import io.github.flameyossnowy.linkage.api.meta.EntityModel;
import io.github.flameyossnowy.linkage.api.meta.FieldModel;
import io.github.flameyossnowy.linkage.api.meta.RelationDescriptor;

final class Accounts {
    static final EntityModel<Account> ACCOUNTS = EntityModel.builder("account", "accounts", Account.class, Account::new)
        .field(FieldModel.<Account>builder("id", Long.class).id().autoIncrement().accessors(Account::getId, Account::setId).build())
        .field(FieldModel.<Account>builder("email", String.class).unique().accessors(Account::getEmail, Account::setEmail).build())
        .field(FieldModel.<Account>builder("name", String.class).nullable().accessors(Account::getName, Account::setName).build())
        .field(FieldModel.<Account>builder("data", JsonNode.class).nullable().json().accessors(Account::getData, Account::setData).build())
        .relation(RelationDescriptor.<Account>hasMany("orders", "order").foreignKey("accountId", "account_id").targetTable("orders", "id").build())
        .build();

    static final EntityModel<Order> ORDERS = EntityModel.builder("order", "orders", Order.class, Order::new)
        .field(FieldModel.<Order>builder("id", Long.class).id().autoIncrement().accessors(Order::getId, Order::setId).build())
        .field(FieldModel.<Order>builder("total", Double.class).accessors(Order::getTotal, Order::setTotal).build())
        .field(FieldModel.<Order>builder("accountId", Long.class).column("account_id").accessors(Order::getAccountId, Order::setAccountId).build())
        .build();

    private Accounts() {}

    static final class Account {
        private Long id;
        private String email;
        private String name;
        private JsonNode data;

        public Long getId() {
            return id;
        }

        public void setId(Long id) {
            this.id = id;
        }

        public String getEmail() {
            return email;
        }

        public void setEmail(String email) {
            this.email = email;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public JsonNode getData() {
            return data;
        }

        public void setData(JsonNode data) {
            this.data = data;
        }
    }

    static final class Order {
        private Long id;
        private Double total;
        private Long accountId;

        public Long getId() {
            return id;
        }

        public void setId(Long id) {
            this.id = id;
        }

        public Double getTotal() {
            return total;
        }

        public void setTotal(Double total) {
            this.total = total;
        }

        public Long getAccountId() {
            return accountId;
        }

        public void setAccountId(Long accountId) {
            this.accountId = accountId;
        }
    }
}
